package uk.gegc.docpond.features.document.domain.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.docpond.features.document.application.PageProcessor;

@Component
@RequiredArgsConstructor
@Slf4j
public class PageProcessingRequestedEventListener {

    private final PageProcessor pageProcessor;

    @Async("pageTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handlePageProcessingRequest(PageProcessingRequestedEvent event) {
        log.debug("Received PageProcessingRequestedEvent for page {}", event.getPageId());
        pageProcessor.process(event.getPageId());
    }
}
