package it.aw.readingqueue.service;

import it.aw.readingqueue.error.ValidationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

/**
 * Normalizza l'URL inviato dall'utente prima di creare l'item: rimuove gli spazi,
 * aggiunge {@code https://} se manca lo schema e rifiuta host che non siano un
 * dominio valido, un indirizzo IPv4 o {@code localhost}.
 */
public final class UrlPreparer {

    private static final Pattern DOMAIN = Pattern.compile(
            "^[a-zA-Z0-9]([a-zA-Z0-9\\-]{0,61}[a-zA-Z0-9])?(\\.[a-zA-Z0-9]([a-zA-Z0-9\\-]{0,61}[a-zA-Z0-9])?)*$");
    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}$");

    private UrlPreparer() {
    }

    public static String prepare(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new ValidationException("URL obbligatorio");
        }
        String candidate = rawUrl.strip();
        if (!candidate.startsWith("http://") && !candidate.startsWith("https://")) {
            candidate = "https://" + candidate;
        }

        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            throw new ValidationException("URL non valido: " + rawUrl, e);
        }
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new ValidationException("URL non valido: " + rawUrl);
        }
        if ("localhost".equals(host) || IPV4.matcher(host).matches()) {
            return candidate;
        }
        if (!DOMAIN.matcher(host).matches() || host.indexOf('.') < 0) {
            throw new ValidationException("URL senza un dominio valido: " + rawUrl);
        }
        return candidate;
    }
}
