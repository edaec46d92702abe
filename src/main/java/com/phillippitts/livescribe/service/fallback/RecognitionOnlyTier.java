package com.phillippitts.livescribe.service.fallback;

import com.phillippitts.livescribe.domain.RecognitionResult;
import com.phillippitts.livescribe.exception.RecognitionException;
import com.phillippitts.livescribe.service.stt.RecognitionEngine;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Local recognition without speaker attribution. The last resort of the chain.
 */
public class RecognitionOnlyTier implements ProviderTier {

    private final RecognitionEngine engine;

    public RecognitionOnlyTier(RecognitionEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public String name() {
        return TierNames.RECOGNITION_ONLY;
    }

    @Override
    public boolean isAvailable() {
        return engine.isAvailable();
    }

    @Override
    public ProviderResult transcribe(Path wav) {
        try {
            engine.initialize();
            RecognitionResult result = engine.recognizeFile(wav);
            return ProviderResult.ok(name(), FileSegments.from(result, wav));
        } catch (RecognitionException e) {
            return ProviderResult.err(name(), FailureKind.ERROR, e.getMessage());
        }
    }
}
