package com.example.trackscheduler.application.service;

import com.example.trackscheduler.api.response.ScopeResponse;
import com.example.trackscheduler.api.response.TrackResponse;
import com.example.trackscheduler.domain.model.PlaybackScope;
import com.example.trackscheduler.domain.model.TrackRecord;
import com.example.trackscheduler.domain.model.TrackSelection;
import org.springframework.stereotype.Component;

/**
 * Maps scheduler results to API responses.
 */
@Component
public class TrackPresenter {

    private final UnplayableTrackService unplayableTrackService;

    public TrackPresenter(UnplayableTrackService unplayableTrackService) {
        this.unplayableTrackService = unplayableTrackService;
    }

    public TrackResponse toResponse(TrackSelection selection) {
        if (selection == null) {
            return null;
        }
        return toResponse(selection.getIndex(), selection.getRecord());
    }

    public TrackResponse toResponse(int index, TrackRecord record) {
        if (record == null) {
            return null;
        }
        return new TrackResponse(
                index,
                record.getPath(),
                record.getTitle(),
                record.getArtist(),
                record.getAlbum(),
                record.getDurationSec(),
                record.isHydrated(),
                unplayableTrackService.reason(record.getPath())
        );
    }

    public ScopeResponse toResponse(PlaybackScope scope, int playableCount) {
        return new ScopeResponse(scope.getKind().getValue(), scope.getPlaylistId(), playableCount);
    }
}
