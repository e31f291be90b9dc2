package com.newsdigest.bot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Item Store에 접근할 수 없을 때 프로세스를 종료합니다 (exit code 2).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FatalErrorHandler {

    static final int EXIT_CODE = 2;

    private final ConfigurableApplicationContext applicationContext;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public void storeUnavailable(Throwable cause) {
        log.error("[Digest] Item store unreachable, shutting down: {}", cause.getMessage(), cause);
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        // 사이클 락을 쥔 스레드에서 컨텍스트를 닫지 않도록 별도 스레드에서 종료
        Thread shutdown = new Thread(() -> System.exit(SpringApplication.exit(applicationContext, () -> EXIT_CODE)),
                "fatal-shutdown");
        shutdown.start();
    }
}
