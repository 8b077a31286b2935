package com.verlumen.curvestream.http;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Ascii;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.CharStreams;
import com.google.inject.Inject;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.HttpURLConnection;
import java.util.Map;

final class HttpClientImpl implements HttpClient {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final HttpURLConnectionFactory connectionFactory;

    @Inject
    HttpClientImpl(HttpURLConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    @Override
    public String get(String url, Map<String, String> headers) throws IOException {
        HttpURLConnection connection = connectionFactory.create(url);
        try {
            connection.setRequestMethod("GET");
            headers.forEach(connection::setRequestProperty);

            int status = connection.getResponseCode();
            logger.atFine().log("GET %s answered %d", url, status);
            if (status != HttpURLConnection.HTTP_OK) {
                String detail = readQuietly(connection.getErrorStream());
                throw new IOException(
                    String.format(
                        "GET %s failed with HTTP code %d%s",
                        url, status, detail.isEmpty() ? "" : ": " + detail));
            }
            return read(connection.getInputStream());
        } finally {
            connection.disconnect();
        }
    }

    private static String read(InputStream stream) throws IOException {
        try (Reader in = new InputStreamReader(stream, UTF_8)) {
            return CharStreams.toString(in);
        }
    }

    /** Reads an error body for the exception message. A body that cannot be read is left out. */
    private static String readQuietly(InputStream stream) {
        if (stream == null) {
            return "";
        }
        try {
            return Ascii.truncate(read(stream).trim(), MAX_ERROR_BODY_CHARS, "...");
        } catch (IOException e) {
            logger.atFine().withCause(e).log("Could not read error body");
            return "";
        }
    }
}
