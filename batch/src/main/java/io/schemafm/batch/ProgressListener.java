package io.schemafm.batch;

import io.schemafm.core.spi.PipelineListener;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs generation milestones and periodic document progress. Thread-safe.
 */
final class ProgressListener implements PipelineListener {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressListener.class);

    private final long every;
    private final AtomicLong checked = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    /**
     * @param every log a progress line after this many documents
     */
    ProgressListener(long every) {
        if (every <= 0) {
            throw new IllegalArgumentException("every must be positive, got: " + every);
        }
        this.every = every;
    }

    @Override
    public void onKindSynthesized(KindSynthesizedEvent event) {
        LOG.debug("Synthesized kind {} from {}: {} features, {} constraints",
                event.kindId(), event.definition(), event.features(), event.constraints());
    }

    @Override
    public void onModelGenerated(ModelGeneratedEvent event) {
        LOG.info("Model {} ready: {} kinds, {} features, {} constraints",
                event.namespace(), event.kinds(), event.features(), event.constraints());
    }

    @Override
    public void onDocumentChecked(DocumentCheckedEvent event) {
        tick();
    }

    @Override
    public void onDocumentFailed(DocumentFailedEvent event) {
        failed.incrementAndGet();
        tick();
    }

    long checked() {
        return checked.get();
    }

    private void tick() {
        long n = checked.incrementAndGet();
        if (n % every == 0) {
            LOG.info("Progress: {} documents checked, {} failed", n, failed.get());
        }
    }
}
