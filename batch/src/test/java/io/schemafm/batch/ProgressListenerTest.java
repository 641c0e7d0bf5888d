package io.schemafm.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.schemafm.core.spi.PipelineListener.DocumentCheckedEvent;
import io.schemafm.core.spi.PipelineListener.DocumentFailedEvent;
import io.schemafm.core.spi.PipelineListener.ModelGeneratedEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("ProgressListener")
class ProgressListenerTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger listenerLogger;

    @BeforeEach
    void setUp() {
        listenerLogger = (Logger) LoggerFactory.getLogger(ProgressListener.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        listenerLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        listenerLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("logs progress every n documents, failures included")
    void progressLines() {
        ProgressListener listener = new ProgressListener(2);

        listener.onDocumentChecked(new DocumentCheckedEvent("a.yaml", true, 0, 0, 1));
        listener.onDocumentFailed(new DocumentFailedEvent("b.yaml", 1, "Document root is not a mapping"));
        listener.onDocumentChecked(new DocumentCheckedEvent("c.yaml", false, 2, 1, 1));

        assertThat(listener.checked()).isEqualTo(3);
        assertThat(logAppender.list)
                .filteredOn(e -> e.getFormattedMessage().startsWith("Progress"))
                .singleElement()
                .satisfies(e -> assertThat(e.getFormattedMessage()).isEqualTo("Progress: 2 documents checked, 1 failed"));
    }

    @Test
    @DisplayName("announces the generated model")
    void modelGenerated() {
        new ProgressListener(10).onModelGenerated(new ModelGeneratedEvent("k8s", 2, 40, 3, 12));

        assertThat(logAppender.list).singleElement().satisfies(e -> {
            assertThat(e.getLevel()).isEqualTo(Level.INFO);
            assertThat(e.getFormattedMessage()).isEqualTo("Model k8s ready: 2 kinds, 40 features, 3 constraints");
        });
    }

    @Test
    @DisplayName("rejects a non-positive interval")
    void invalidInterval() {
        assertThatThrownBy(() -> new ProgressListener(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
