package it.aw.readingqueue.provider;

import it.aw.readingqueue.error.ExtractionException;
import it.aw.readingqueue.model.ArticleContent;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Estrazione del contenuto di un articolo con Jsoup.
 * <p>
 * Il body viene ripulito da script, navigazione e footer; il contenuto è preso
 * dal primo contenitore "articolo" trovato, altrimenti dall'intero body.
 * Produce sia testo piano (per embedding e indice lessicale) sia una resa
 * markdown essenziale (per il prompt di sintesi).
 */
@Component
public class JsoupContentExtractor implements ContentExtractor {

    private static final Logger log = LoggerFactory.getLogger(JsoupContentExtractor.class);

    static final int MIN_CONTENT_LENGTH = 10;

    private static final String NOISE = "script,noscript,style,header,footer,nav,aside,form,iframe,svg";
    private static final String CONTAINERS = "article, main, [role=main], #content, .post, .entry-content, .article, .post-body";
    private static final String BLOCKS = "h1, h2, h3, h4, h5, h6, p, li, blockquote, pre";
    private static final Pattern OFFSET_SUFFIX = Pattern.compile("(Z|[+-]\\d{2}:\\d{2})$");
    private static final String USER_AGENT = "Mozilla/5.0 (compatible; ReadingQueue/1.0)";

    private final ProviderCalls calls;

    public JsoupContentExtractor(ProviderCalls calls) {
        this.calls = calls;
    }

    @Override
    public ArticleContent extract(String url) {
        int jsoupTimeout = (int) Math.max(1000, calls.timeout().toMillis());
        Document doc = calls.call("extraction", () -> fetch(url, jsoupTimeout));
        return parse(doc, url);
    }

    private Document fetch(String url, int timeoutMs) {
        try {
            return Jsoup.connect(url)
                    .userAgent(USER_AGENT)
                    .followRedirects(true)
                    .timeout(timeoutMs)
                    .get();
        } catch (SocketTimeoutException e) {
            // lasciata risalire: ProviderCalls la traduce in ProviderTimeoutException
            throw new IllegalStateException("Timeout scaricando " + url, e);
        } catch (HttpStatusException e) {
            throw new ExtractionException("Download fallito: HTTP " + e.getStatusCode() + " per " + url, e);
        } catch (IOException e) {
            throw new ExtractionException("Download fallito per " + url + ": " + e.getMessage(), e);
        }
    }

    /** Estrae metadati e contenuto da un documento già scaricato. */
    public static ArticleContent parse(Document doc, String url) {
        String canonical = normalizeUrl(firstAttr(doc, "link[rel=canonical]", "href"), url);
        if (canonical == null) {
            canonical = normalizeUrl(firstAttr(doc, "meta[property=og:url]", "content"), url);
        }

        String title = firstAttr(doc, "meta[property=og:title]", "content");
        if (title == null && !doc.title().isBlank()) {
            title = doc.title().strip();
        }

        URI base = toUri(canonical != null ? canonical : url);
        String site = firstAttr(doc, "meta[property=og:site_name]", "content");
        if (site == null && base != null) {
            site = base.getHost();
        }
        String favicon = base != null && base.getScheme() != null && base.getHost() != null
                ? base.getScheme() + "://" + base.getRawAuthority() + "/favicon.ico"
                : null;

        LocalDateTime published = parseDate(firstAttr(doc, "meta[property=article:published_time]", "content"));
        if (published == null) {
            published = parseDate(firstAttr(doc, "meta[name=date]", "content"));
        }
        if (published == null) {
            published = parseDate(firstAttr(doc, "time[datetime]", "datetime"));
        }

        Element body = doc.body();
        if (body == null) {
            throw new ExtractionException("Estrazione fallita: la pagina non ha body.");
        }
        body.select(NOISE).remove();
        Element container = body.selectFirst(CONTAINERS);
        if (container == null) {
            container = body;
        }

        List<String> textBlocks = new ArrayList<>();
        List<String> markdownBlocks = new ArrayList<>();
        Elements blocks = container.select(BLOCKS);
        for (Element block : blocks) {
            // i blocchi annidati (p dentro li/blockquote) sono già coperti dal contenitore
            if (block.parents().is(BLOCKS)) {
                continue;
            }
            String text = clean(block.text());
            if (text.isEmpty()) {
                continue;
            }
            textBlocks.add(text);
            markdownBlocks.add(toMarkdown(block, text));
        }
        if (textBlocks.isEmpty()) {
            String fallback = clean(container.text());
            if (!fallback.isEmpty()) {
                textBlocks.add(fallback);
                markdownBlocks.add(fallback);
            }
        }

        String contentText = String.join("\n\n", textBlocks).strip();
        if (contentText.length() < MIN_CONTENT_LENGTH) {
            throw new ExtractionException("Estrazione fallita: contenuto insufficiente nella pagina.");
        }
        String contentMarkdown = String.join("\n\n", markdownBlocks).strip();

        log.debug("Estratti {} blocchi da {} (canonical={})", textBlocks.size(), url, canonical);
        return new ArticleContent(url, canonical, title, site, published, favicon, contentText, contentMarkdown);
    }

    private static String toMarkdown(Element block, String text) {
        String tag = block.normalName();
        return switch (tag) {
            case "h1", "h2", "h3", "h4", "h5", "h6" -> "#".repeat(tag.charAt(1) - '0') + " " + text;
            case "li" -> "- " + text;
            case "blockquote" -> "> " + text;
            case "pre" -> "```\n" + block.wholeText().strip() + "\n```";
            default -> text;
        };
    }

    private static String clean(String text) {
        return text.replace('\u00A0', ' ').replaceAll("\\s{2,}", " ").strip();
    }

    private static String firstAttr(Document doc, String selector, String attr) {
        Element el = doc.selectFirst(selector);
        if (el == null) {
            return null;
        }
        String value = el.attr(attr).strip();
        return value.isEmpty() ? null : value;
    }

    static String normalizeUrl(String value, String base) {
        if (value == null) {
            return null;
        }
        URI baseUri = toUri(base);
        URI candidate = toUri(value);
        if (candidate == null) {
            return null;
        }
        if (baseUri != null) {
            candidate = baseUri.resolve(candidate);
        }
        String scheme = candidate.getScheme();
        if (("http".equals(scheme) || "https".equals(scheme)) && candidate.getHost() != null) {
            return candidate.toString();
        }
        return null;
    }

    private static URI toUri(String value) {
        if (value == null) {
            return null;
        }
        try {
            return new URI(value.strip());
        } catch (URISyntaxException e) {
            log.debug("URL non valido ignorato: {}", value);
            return null;
        }
    }

    static LocalDateTime parseDate(String value) {
        if (value == null) {
            return null;
        }
        String v = value.strip();
        try {
            if (OFFSET_SUFFIX.matcher(v).find()) {
                return OffsetDateTime.parse(v).toLocalDateTime();
            }
            if (v.indexOf('T') > 0) {
                return LocalDateTime.parse(v);
            }
            return v.length() >= 10 ? LocalDate.parse(v.substring(0, 10)).atStartOfDay() : null;
        } catch (DateTimeParseException e) {
            log.debug("Data di pubblicazione non riconosciuta: {}", value);
            return null;
        }
    }
}
