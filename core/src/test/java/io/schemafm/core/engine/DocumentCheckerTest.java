package io.schemafm.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.schemafm.core.testkit.Fixtures;
import io.schemafm.core.translate.TranslationBudget;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

@DisplayName("DocumentChecker")
class DocumentCheckerTest {

    private static GeneratedModel pod;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger checkerLogger;
    private ModelPipelineTest.RecordingListener listener;
    private DocumentChecker checker;

    @BeforeAll
    static void generate() {
        pod = Fixtures.podModel();
    }

    @BeforeEach
    void setUp() {
        checkerLogger = (Logger) LoggerFactory.getLogger(DocumentChecker.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        checkerLogger.addAppender(logAppender);
        listener = new ModelPipelineTest.RecordingListener();
        checker = new DocumentChecker(pod.model(), pod.mapping(), null, TranslationBudget.DEFAULT, listener);
    }

    @AfterEach
    void tearDown() {
        checkerLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("a checked document carries its selection and report")
    void checked() {
        DocumentResult result = checker.check(Fixtures.document("documents/pod-missing-containers.yaml"), "missing");

        assertThat(result.failed()).isFalse();
        assertThat(result.valid()).isFalse();
        assertThat(result.report().violations()).containsExactly("mandatory:Pod.spec.containers");
        assertThat(result.selection().isSelected("Pod.spec")).isTrue();
        assertThat(listener.checked).singleElement().satisfies(e -> {
            assertThat(e.documentId()).isEqualTo("missing");
            assertThat(e.valid()).isFalse();
            assertThat(e.violations()).isEqualTo(1);
        });
    }

    @Test
    @DisplayName("an untranslatable document becomes a failed result and a warning")
    void failed() {
        DocumentResult result = checker.check(Fixtures.yaml("just a string"), "scalar.yaml");

        assertThat(result.failed()).isTrue();
        assertThat(result.valid()).isFalse();
        assertThat(result.error()).isEqualTo("Document root is not a mapping");
        assertThat(result.report()).isNull();
        assertThat(listener.failed).singleElement()
                .satisfies(e -> assertThat(e.errorDetail()).isEqualTo("Document root is not a mapping"));

        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.getFormattedMessage())
                            .isEqualTo("Document scalar.yaml failed: Document root is not a mapping");
                    assertThat(e.getMDCPropertyMap()).containsEntry("document", "scalar.yaml");
                });
    }

    @Test
    @DisplayName("the document id is cleared from the MDC afterwards")
    void mdcCleared() {
        checker.check(Fixtures.document("documents/pod-valid.yaml"), "pod-valid.yaml");

        assertThat(MDC.get("document")).isNull();
    }

    @Test
    @DisplayName("a valid document is valid")
    void valid() {
        assertThat(checker.check(Fixtures.document("documents/pod-valid.yaml"), "pod-valid.yaml").valid()).isTrue();
    }
}
