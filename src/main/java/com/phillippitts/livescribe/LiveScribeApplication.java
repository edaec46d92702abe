package com.phillippitts.livescribe;

import com.phillippitts.livescribe.config.properties.AlignmentProperties;
import com.phillippitts.livescribe.config.properties.FallbackProperties;
import com.phillippitts.livescribe.config.properties.FileTranscriptionProperties;
import com.phillippitts.livescribe.config.properties.SegmenterProperties;
import com.phillippitts.livescribe.config.properties.StreamProperties;
import com.phillippitts.livescribe.config.properties.ThreadPoolProperties;
import com.phillippitts.livescribe.config.properties.TranscriptProperties;
import com.phillippitts.livescribe.config.properties.WorkerProperties;
import com.phillippitts.livescribe.config.stt.DiarizationConfig;
import com.phillippitts.livescribe.config.stt.ScribeProperties;
import com.phillippitts.livescribe.config.stt.WhisperConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        WhisperConfig.class,
        DiarizationConfig.class,
        ScribeProperties.class,
        StreamProperties.class,
        FileTranscriptionProperties.class,
        WorkerProperties.class,
        TranscriptProperties.class,
        SegmenterProperties.class,
        AlignmentProperties.class,
        FallbackProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class LiveScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveScribeApplication.class, args);
    }

}
