package it.aw.readingqueue.provider;

import it.aw.readingqueue.error.ExtractionException;
import it.aw.readingqueue.model.ArticleContent;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsoupContentExtractorTest {

    private static final String URL = "https://blog.example.com/posts/borrow-checker?utm_source=feed";

    private static ArticleContent parse(String html) {
        return JsoupContentExtractor.parse(Jsoup.parse(html, URL), URL);
    }

    @Nested
    @DisplayName("metadati")
    class Metadata {

        @Test
        @DisplayName("open graph e link canonical hanno la precedenza")
        void openGraph() {
            ArticleContent content = parse("""
                    <html><head>
                      <title>Titolo della pagina | Blog</title>
                      <link rel="canonical" href="/posts/borrow-checker">
                      <meta property="og:title" content="Il borrow checker">
                      <meta property="og:site_name" content="Example Blog">
                      <meta property="article:published_time" content="2024-03-10T08:30:00+01:00">
                    </head><body><article><p>Il borrow checker applica le regole di ownership.</p></article></body></html>
                    """);

            assertThat(content.url()).isEqualTo(URL);
            assertThat(content.canonicalUrl()).isEqualTo("https://blog.example.com/posts/borrow-checker");
            assertThat(content.dedupKey()).isEqualTo(content.canonicalUrl());
            assertThat(content.title()).isEqualTo("Il borrow checker");
            assertThat(content.sourceSite()).isEqualTo("Example Blog");
            assertThat(content.publicationDate()).isEqualTo(LocalDateTime.of(2024, 3, 10, 8, 30));
            assertThat(content.faviconUrl()).isEqualTo("https://blog.example.com/favicon.ico");
        }

        @Test
        @DisplayName("senza metadati: titolo della pagina, host e URL richiesto come chiave")
        void fallbacks() {
            ArticleContent content = parse("""
                    <html><head><title> Note sparse </title></head>
                    <body><p>Un paragrafo abbastanza lungo.</p></body></html>
                    """);

            assertThat(content.canonicalUrl()).isNull();
            assertThat(content.dedupKey()).isEqualTo(URL);
            assertThat(content.title()).isEqualTo("Note sparse");
            assertThat(content.sourceSite()).isEqualTo("blog.example.com");
            assertThat(content.publicationDate()).isNull();
        }

        @Test
        @DisplayName("canonical non http ignorato")
        void nonHttpCanonical() {
            ArticleContent content = parse("""
                    <html><head><link rel="canonical" href="javascript:void(0)"></head>
                    <body><p>Un paragrafo abbastanza lungo.</p></body></html>
                    """);

            assertThat(content.canonicalUrl()).isNull();
        }
    }

    @Nested
    @DisplayName("contenuto")
    class Content {

        @Test
        @DisplayName("rumore rimosso e contenitore articolo preferito")
        void stripsNoise() {
            ArticleContent content = parse("""
                    <html><body>
                      <nav><a href="/">Home</a></nav>
                      <div class="sidebar"><p>Iscriviti alla newsletter</p></div>
                      <article>
                        <h2>Ownership</h2>
                        <p>Ogni valore ha un solo proprietario.</p>
                        <ul><li>move</li><li>borrow</li></ul>
                        <script>track()</script>
                      </article>
                      <footer>Copyright</footer>
                    </body></html>
                    """);

            assertThat(content.contentText())
                    .isEqualTo("Ownership\n\nOgni valore ha un solo proprietario.\n\nmove\n\nborrow")
                    .doesNotContain("newsletter", "Home", "Copyright", "track");
            assertThat(content.contentMarkdown())
                    .isEqualTo("## Ownership\n\nOgni valore ha un solo proprietario.\n\n- move\n\n- borrow");
        }

        @Test
        @DisplayName("blocchi annidati non duplicati")
        void nestedBlocks() {
            ArticleContent content = parse("""
                    <html><body><main>
                      <blockquote><p>Citazione importante qui.</p></blockquote>
                    </main></body></html>
                    """);

            assertThat(content.contentText()).isEqualTo("Citazione importante qui.");
            assertThat(content.contentMarkdown()).isEqualTo("> Citazione importante qui.");
        }

        @Test
        @DisplayName("pagina quasi vuota: estrazione fallita")
        void tooShort() {
            assertThatThrownBy(() -> parse("<html><body><p>ciao</p></body></html>"))
                    .isInstanceOf(ExtractionException.class);
        }
    }

    @ParameterizedTest
    @CsvSource({
            "2024-03-10T08:30:00Z,       2024-03-10T08:30",
            "2024-03-10T08:30:00,        2024-03-10T08:30",
            "2024-03-10,                 2024-03-10T00:00",
            "'2024-03-10 alle 8',        2024-03-10T00:00"
    })
    void parsesDates(String raw, LocalDateTime expected) {
        assertThat(JsoupContentExtractor.parseDate(raw)).isEqualTo(expected);
    }

    @Test
    void unparseableDateIsNull() {
        assertThat(JsoupContentExtractor.parseDate("ieri")).isNull();
        assertThat(JsoupContentExtractor.parseDate("10/03/2024")).isNull();
    }
}
