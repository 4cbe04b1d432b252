package com.example.media_analyzer.service.Interfaces;

import com.example.media_analyzer.dto.media.MediaProbe;
import com.example.media_analyzer.sampling.VideoSource;

import java.nio.file.Path;

/**
 * Local media operations needed by the analysis pipeline.
 */
public interface MediaToolkit {

    /**
     * @throws com.example.media_analyzer.exception.SourceUnreadableException when the file cannot be probed.
     */
    MediaProbe probe(Path media);

    /**
     * Writes the audio track as 16 kHz mono MP3, the format transcription providers handle best.
     *
     * @throws com.example.media_analyzer.exception.MediaProcessingException when ffmpeg fails.
     */
    Path extractAudio(Path media, Path targetMp3);

    /**
     * Opens the video for frame sampling. Grabbed frames are written below {@code frameDir}.
     */
    VideoSource openVideo(Path video, MediaProbe probe, Path frameDir);
}
