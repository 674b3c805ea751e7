package org.crash.service.crash.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/** Arrêt du process sur erreur fatale (source d'aléa en panne). */
@Component
public class ProcessTerminator {
    private static final Logger log = LoggerFactory.getLogger(ProcessTerminator.class);

    private final ApplicationContext context;

    public ProcessTerminator(ApplicationContext context) {
        this.context = context;
    }

    public void terminate(Throwable cause) {
        log.error("Erreur fatale, arrêt du process", cause);
        int code = SpringApplication.exit(context, () -> 1);
        System.exit(code);
    }
}
