package com.example.trackscheduler.infrastructure.parser;

import com.example.trackscheduler.domain.model.AudioMetadata;
import java.io.File;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.springframework.stereotype.Component;

/**
 * Reads the handful of tags shown for a hydrated playlist member.
 */
@Component
public class JaudiotaggerAudioMetadataParser implements AudioMetadataParser {

    @Override
    public AudioMetadata parse(File audioFile) throws Exception {
        AudioFile parsed = AudioFileIO.read(audioFile);
        Tag tag = parsed.getTag();
        AudioHeader header = parsed.getAudioHeader();

        AudioMetadata metadata = new AudioMetadata();
        metadata.setTitle(safeTagValue(tag, FieldKey.TITLE));
        metadata.setArtist(safeTagValue(tag, FieldKey.ARTIST));
        metadata.setAlbum(safeTagValue(tag, FieldKey.ALBUM));
        if (header != null && header.getTrackLength() > 0) {
            metadata.setDurationSec(header.getTrackLength());
        }
        return metadata;
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey) {
        if (tag == null) {
            return null;
        }
        String value = tag.getFirst(fieldKey);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
