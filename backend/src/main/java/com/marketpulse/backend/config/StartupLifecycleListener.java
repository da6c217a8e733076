package com.marketpulse.backend.config;

import com.marketpulse.backend.exception.FatalConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationFailedEvent;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class StartupLifecycleListener implements ApplicationListener<ApplicationFailedEvent> {

    @Override
    public void onApplicationEvent(ApplicationFailedEvent event) {
        Throwable exception = event.getException();
        Throwable root = rootCause(exception);
        if (root instanceof FatalConfigException fatal) {
            fatal.getProblems().forEach(problem -> log.error("FATAL config: {}", problem));
            return;
        }
        log.error("FATAL Startup failure. Root cause: {}", root.getMessage(), exception);
    }

    @Component
    @Slf4j
    public static class StartupReadyListener implements ApplicationListener<ApplicationReadyEvent> {
        @Override
        public void onApplicationEvent(ApplicationReadyEvent event) {
            log.info("Market pulse backend ready");
        }
    }

    private Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
