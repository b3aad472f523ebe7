package com.cityexplorer.backend.infrastructure.adapter.provider;

import com.cityexplorer.backend.domain.exception.NoUpstreamDataException;
import com.cityexplorer.backend.domain.exception.UpstreamException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.Response;

/**
 * Shared call handling of the provider clients: runs the Retrofit call off the caller's thread,
 * turns failed responses into {@link UpstreamException} and empty results into
 * {@link NoUpstreamDataException}. Nothing is retried.
 */
public abstract class UpstreamClient {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final String provider;

    protected UpstreamClient(String provider) {
        this.provider = provider;
    }

    protected <T> CompletableFuture<List<Map<String, Object>>> fetch(Supplier<Call<T>> request,
                                                                     Function<T, List<Map<String, Object>>> mapper) {
        return CompletableFuture.supplyAsync(() -> {
            logger.debug("Fetching from {} via Retrofit", provider);

            Response<T> response;
            try {
                response = request.get().execute();
            } catch (IOException e) {
                logger.error("Exception fetching from {}: {}", provider, e.getMessage());
                throw new UpstreamException("Failed to call " + provider, e);
            }

            if (!response.isSuccessful() || response.body() == null) {
                logger.warn("Empty or failed response from {}: HTTP {}", provider, response.code());
                throw new UpstreamException(provider + " responded with HTTP " + response.code());
            }

            List<Map<String, Object>> records = mapper.apply(response.body());
            if (records.isEmpty()) {
                throw new NoUpstreamDataException(provider);
            }
            logger.debug("Fetched {} records from {}", records.size(), provider);
            return records;
        });
    }

    protected static <T> List<T> orEmpty(List<T> items) {
        return items != null ? items : List.of();
    }
}
