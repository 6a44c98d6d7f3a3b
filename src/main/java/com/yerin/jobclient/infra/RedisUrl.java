package com.yerin.jobclient.infra;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Parsed form of {@code redis://[user[:password]@]host[:port][/db]}.
 * {@code rediss://} selects TLS.
 */
public record RedisUrl(String host, int port, int database, String username, String password, boolean ssl) {

    public static final int DEFAULT_PORT = 6379;

    public static RedisUrl parse(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("redis url must not be blank");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid redis url: " + url, e);
        }

        String scheme = uri.getScheme();
        boolean ssl;
        if ("redis".equalsIgnoreCase(scheme)) {
            ssl = false;
        } else if ("rediss".equalsIgnoreCase(scheme)) {
            ssl = true;
        } else {
            throw new IllegalArgumentException("unsupported redis url scheme: " + scheme);
        }

        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("redis url has no host: " + url);
        }
        int port = uri.getPort() == -1 ? DEFAULT_PORT : uri.getPort();

        int database = 0;
        String path = uri.getPath();
        if (path != null && path.length() > 1) {
            try {
                database = Integer.parseInt(path.substring(1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid redis database index: " + path, e);
            }
            if (database < 0) {
                throw new IllegalArgumentException("invalid redis database index: " + database);
            }
        }

        String username = null;
        String password = null;
        String userInfo = uri.getRawUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int colon = userInfo.indexOf(':');
            if (colon < 0) {
                // redis://secret@host 형태는 비밀번호만 지정한 것으로 본다
                password = decode(userInfo);
            } else {
                String user = userInfo.substring(0, colon);
                username = user.isEmpty() ? null : decode(user);
                password = decode(userInfo.substring(colon + 1));
            }
        }
        return new RedisUrl(host, port, database, username, password, ssl);
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return (ssl ? "rediss" : "redis") + "://" + host + ":" + port + "/" + database;
    }
}
