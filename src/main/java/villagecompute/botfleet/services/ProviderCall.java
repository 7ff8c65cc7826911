package villagecompute.botfleet.services;

/**
 * A single provider attempt measured by {@link GenerationTelemetryService}.
 *
 * @param <T>
 *            result type
 */
@FunctionalInterface
public interface ProviderCall<T> {

    T call() throws Exception;
}
