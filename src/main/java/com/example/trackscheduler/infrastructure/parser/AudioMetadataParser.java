package com.example.trackscheduler.infrastructure.parser;

import com.example.trackscheduler.domain.model.AudioMetadata;
import java.io.File;

public interface AudioMetadataParser {

    AudioMetadata parse(File audioFile) throws Exception;
}
