package com.verlumen.curvestream.http;

import com.google.inject.Inject;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URL;

final class HttpURLConnectionFactoryImpl implements HttpURLConnectionFactory {
  private static final int TIMEOUT_MILLIS = 20_000;

  @Inject
  HttpURLConnectionFactoryImpl() {}

  @Override
  public HttpURLConnection create(String url) throws IOException {
    URL parsed;
    try {
      parsed = URI.create(url).toURL();
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid URL: " + url, e);
    }
    HttpURLConnection connection = (HttpURLConnection) parsed.openConnection();
    connection.setConnectTimeout(TIMEOUT_MILLIS);
    connection.setReadTimeout(TIMEOUT_MILLIS);
    return connection;
  }
}
