package dev.evalbench.stream;

/** Receives decoded push events for one correlation id. */
public interface StreamListener {

    void onProgress(String correlationId, ProgressEvent event);

    void onResult(String correlationId, ResultEvent event);

    void onLog(String correlationId, String line);
}
