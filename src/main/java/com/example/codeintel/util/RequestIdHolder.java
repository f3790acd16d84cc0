package com.example.codeintel.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Mantiene el requestId en el MDC del hilo actual y lo traslada a los jobs en segundo plano.
 */
public final class RequestIdHolder {

    public static final String MDC_KEY = "requestId";

    private RequestIdHolder() {
    }

    public static String get() {
        String id = MDC.get(MDC_KEY);
        return (id == null || id.isBlank()) ? null : id;
    }

    public static String ensure() {
        String id = get();
        if (id == null) {
            id = generate();
            MDC.put(MDC_KEY, id);
        }
        return id;
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }

    public static Scope use(String requestId) {
        String previous = get();
        if (requestId == null || requestId.isBlank()) {
            MDC.remove(MDC_KEY);
        } else {
            MDC.put(MDC_KEY, requestId);
        }
        return new Scope(previous);
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    /**
     * Envuelve la tarea para que se ejecute con el requestId del hilo que la crea,
     * o con {@code fallbackId} si ese hilo no tenia ninguno.
     */
    public static Runnable propagate(Runnable task, String fallbackId) {
        String captured = get();
        String requestId = captured != null ? captured : fallbackId;
        return () -> {
            try (Scope ignored = use(requestId)) {
                task.run();
            }
        };
    }

    public static final class Scope implements AutoCloseable {
        private final String previous;

        private Scope(String previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                clear();
                return;
            }
            MDC.put(MDC_KEY, previous);
        }
    }
}
