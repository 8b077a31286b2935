package com.verlumen.curvestream.http;

import java.io.IOException;
import java.util.Map;

/** Minimal request layer used to fetch the data an event points at. */
public interface HttpClient {
    /**
     * Issues a GET request and returns the response body.
     *
     * @throws IOException if the request fails or the server does not answer 200 OK
     */
    String get(String url, Map<String, String> headers) throws IOException;
}
