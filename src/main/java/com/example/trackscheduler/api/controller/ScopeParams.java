package com.example.trackscheduler.api.controller;

import com.example.trackscheduler.common.exception.BusinessException;
import com.example.trackscheduler.domain.PlaybackMode;
import com.example.trackscheduler.domain.ScopeKind;
import com.example.trackscheduler.domain.model.PlaybackScope;
import org.springframework.util.StringUtils;

/**
 * Request parameter parsing shared by the controllers.
 */
final class ScopeParams {

    private ScopeParams() {
    }

    /**
     * A blank kind means the queue.
     */
    static PlaybackScope toScope(String kind, String playlistId) {
        if (!StringUtils.hasText(kind)) {
            return PlaybackScope.queue();
        }
        ScopeKind resolved = ScopeKind.fromValue(kind);
        if (resolved == null) {
            throw BusinessException.badRequest("不支持的播放范围: " + kind);
        }
        if (resolved == ScopeKind.QUEUE) {
            return PlaybackScope.queue();
        }
        if (!StringUtils.hasText(playlistId)) {
            throw BusinessException.badRequest("歌单ID不能为空");
        }
        return PlaybackScope.playlist(playlistId);
    }

    static PlaybackMode toMode(String mode) {
        PlaybackMode resolved = PlaybackMode.fromValue(mode);
        if (resolved == null) {
            throw BusinessException.badRequest("不支持的播放模式: " + mode);
        }
        return resolved;
    }
}
