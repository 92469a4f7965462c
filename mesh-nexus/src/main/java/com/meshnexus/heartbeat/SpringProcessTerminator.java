package com.meshnexus.heartbeat;

import com.meshnexus.config.NodeRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

@Component
@NodeRole
@Slf4j
public class SpringProcessTerminator implements ProcessTerminator {

    private final ApplicationContext context;

    public SpringProcessTerminator(ApplicationContext context) {
        this.context = context;
    }

    @Override
    public void terminate(int exitCode) {
        // Closing the context from a scheduler thread would wait on that same thread.
        Thread exit = new Thread(() -> {
            log.info("Exiting with code {}", exitCode);
            System.exit(SpringApplication.exit(context, () -> exitCode));
        }, "mesh-exit");
        exit.start();
    }
}
