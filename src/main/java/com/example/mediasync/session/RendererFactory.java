package com.example.mediasync.session;

/**
 * Acquires fresh renderer instances.
 */
@FunctionalInterface
public interface RendererFactory {

    /**
     * @throws RendererException if no renderer can be started
     */
    Renderer open();

    static RendererFactory unavailable(String reason) {
        return () -> {
            throw new RendererException(reason);
        };
    }
}
