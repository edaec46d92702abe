package com.phillippitts.livescribe.service.stt;

import com.phillippitts.livescribe.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class EngineEventPublisherTest {

    @Test
    void publishesFailureWithContext() {
        EventCapturingPublisher events = new EventCapturingPublisher();
        IllegalStateException cause = new IllegalStateException("boom");

        EngineEventPublisher.publishFailure(events, "whisper", "recognition failure", cause, Map.of("k", "v"));

        assertThat(events.eventsOf(RecognitionFailureEvent.class)).singleElement().satisfies(e -> {
            assertThat(e.engine()).isEqualTo("whisper");
            assertThat(e.cause()).isSameAs(cause);
            assertThat(e.context()).containsEntry("k", "v");
            assertThat(e.at()).isNotNull();
        });
    }

    @Test
    void nullContextBecomesEmptyAndNullPublisherIsIgnored() {
        EventCapturingPublisher events = new EventCapturingPublisher();
        EngineEventPublisher.publishFailure(events, "scribe", "x", null);

        assertThat(events.eventsOf(RecognitionFailureEvent.class).get(0).context()).isEmpty();
        assertThatCode(() -> EngineEventPublisher.publishFailure(null, "scribe", "x", null))
                .doesNotThrowAnyException();
    }
}
