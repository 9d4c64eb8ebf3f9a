package com.github.tubetune.config;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Cookie jar seeded from a Netscape cookies file (the format yt-dlp's
 * {@code --cookies} reads), so HTTP strategies present the same session.
 * Cookies set by responses are kept in memory only.
 */
@Slf4j
public class NetscapeCookieJar implements CookieJar {

    private static final String HTTP_ONLY_PREFIX = "#HttpOnly_";

    private final List<Cookie> cookies = new CopyOnWriteArrayList<>();

    public NetscapeCookieJar() {
    }

    public NetscapeCookieJar(List<Cookie> seed) {
        cookies.addAll(seed);
    }

    /**
     * Load a cookies file. A missing or unreadable file yields an empty jar.
     *
     * @param file Netscape cookies file
     * @return Seeded jar
     */
    public static NetscapeCookieJar fromFile(Path file) {
        try {
            List<Cookie> parsed = parse(Files.readAllLines(file, StandardCharsets.UTF_8));
            log.info("Loaded {} cookie(s) from {}", parsed.size(), file);
            return new NetscapeCookieJar(parsed);
        } catch (IOException e) {
            log.warn("Cannot read cookies file {}: {}", file, e.getMessage());
            return new NetscapeCookieJar();
        }
    }

    /**
     * Parse the lines of a Netscape cookies file, skipping comments and malformed lines.
     */
    static List<Cookie> parse(List<String> lines) {
        List<Cookie> parsed = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.strip();
            boolean httpOnly = line.startsWith(HTTP_ONLY_PREFIX);
            if (httpOnly) {
                line = line.substring(HTTP_ONLY_PREFIX.length());
            } else if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            String[] fields = line.split("\t");
            if (fields.length < 7) {
                continue;
            }

            String domain = fields[0].startsWith(".") ? fields[0].substring(1) : fields[0];
            try {
                Cookie.Builder builder = new Cookie.Builder()
                        .name(fields[5])
                        .value(fields[6])
                        .path(fields[2]);
                if ("TRUE".equalsIgnoreCase(fields[1])) {
                    builder.domain(domain);
                } else {
                    builder.hostOnlyDomain(domain);
                }
                if ("TRUE".equalsIgnoreCase(fields[3])) {
                    builder.secure();
                }
                if (httpOnly) {
                    builder.httpOnly();
                }
                long expiresSeconds = Long.parseLong(fields[4]);
                if (expiresSeconds > 0) {
                    builder.expiresAt(expiresSeconds * 1000);
                }
                parsed.add(builder.build());
            } catch (IllegalArgumentException e) {
                log.debug("Skipping malformed cookie line for domain {}", domain);
            }
        }
        return parsed;
    }

    @Override
    public void saveFromResponse(@NotNull HttpUrl url, @NotNull List<Cookie> received) {
        for (Cookie cookie : received) {
            cookies.removeIf(existing -> existing.name().equals(cookie.name())
                    && existing.domain().equals(cookie.domain())
                    && existing.path().equals(cookie.path()));
            cookies.add(cookie);
        }
    }

    @NotNull
    @Override
    public List<Cookie> loadForRequest(@NotNull HttpUrl url) {
        long now = System.currentTimeMillis();
        List<Cookie> matching = new ArrayList<>();
        for (Cookie cookie : cookies) {
            if (cookie.expiresAt() > now && cookie.matches(url)) {
                matching.add(cookie);
            }
        }
        return matching;
    }

    public int size() {
        return cookies.size();
    }
}
