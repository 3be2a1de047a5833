package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.ppvariant.compiler.model.Token;

import java.util.List;
import java.util.function.Consumer;

/**
 * Receives the events of a variant enumeration.
 */
@FunctionalInterface
public interface VariantReceiver {

    /**
     * Handles one event.
     * <p>
     * For a {@link VariantEvent.Visiting} event, returning {@code false} stops the
     * enumeration from exploring below the current node. The return value for a
     * {@link VariantEvent.Completed} event is ignored.
     *
     * @param event The event.
     * @return true to keep exploring.
     */
    boolean receive(VariantEvent event);

    /**
     * Adapts a consumer that is only interested in completed variants.
     * @param consumer Called with each completed variant.
     * @return A receiver that never prunes.
     */
    static VariantReceiver onCompleted(Consumer<List<Token>> consumer) {
        return event -> {
            if (event instanceof VariantEvent.Completed completed) {
                consumer.accept(completed.tokens());
            }
            return true;
        };
    }
}
