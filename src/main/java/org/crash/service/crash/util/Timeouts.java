package org.crash.service.crash.util;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.*;

/**
 * Timers nommés et annulables. Un groupe = un round (ou le moteur lui-même),
 * ce qui permet de tout annuler d'un coup avant de passer au round suivant.
 */
@Component
public class Timeouts {
    private static final Logger log = LoggerFactory.getLogger(Timeouts.class);

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(3, r -> {
        Thread t = new Thread(r, "crash-timer");
        t.setDaemon(true);
        return t;
    });
    // clé = group:name
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public void schedule(String group, String name, long delayMs, Runnable task) {
        cancel(group, name);
        tasks.put(key(group, name), scheduler.schedule(guarded(group, name, task), delayMs, TimeUnit.MILLISECONDS));
    }

    public void scheduleAtFixedRate(String group, String name, long periodMs, Runnable task) {
        cancel(group, name);
        tasks.put(key(group, name),
                scheduler.scheduleAtFixedRate(guarded(group, name, task), periodMs, periodMs, TimeUnit.MILLISECONDS));
    }

    public void cancel(String group, String name) {
        ScheduledFuture<?> f = tasks.remove(key(group, name));
        if (f != null) f.cancel(false);
    }

    public void cancelAllOf(String group) {
        tasks.keySet().removeIf(k -> {
            if (k.startsWith(group + ":")) {
                ScheduledFuture<?> f = tasks.get(k);
                if (f != null) f.cancel(false);
                return true;
            }
            return false;
        });
    }

    public boolean isScheduled(String group, String name) {
        ScheduledFuture<?> f = tasks.get(key(group, name));
        return f != null && !f.isDone();
    }

    @PreDestroy
    public void shutdown() {
        tasks.values().forEach(f -> f.cancel(false));
        tasks.clear();
        scheduler.shutdownNow();
    }

    // une exception remontée par une tâche périodique l'arrêterait silencieusement
    private Runnable guarded(String group, String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Timer {}:{} en échec", group, name, e);
            }
        };
    }

    private String key(String group, String name) { return group + ":" + name; }
}
