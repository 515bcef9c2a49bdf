package com.flamingo.ai.ragpipeline.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.ragpipeline.service.rag.model.ExtractedDocument;
import com.flamingo.ai.ragpipeline.service.rag.model.PageText;
import com.flamingo.ai.ragpipeline.service.rag.model.SourceDocument;
import com.flamingo.ai.ragpipeline.service.rag.model.TextChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TokenWindowChunker Tests")
class TokenWindowChunkerTest {

  /** One token per whitespace-separated word. */
  private static final TokenCounter WORDS =
      text -> text.isBlank() ? 0 : text.strip().split("\\s+").length;

  /** One token per character, so a long word can exceed the window. */
  private static final TokenCounter CHARS = String::length;

  private static ExtractedDocument document(String... pageTexts) {
    List<PageText> pages = new ArrayList<>();
    for (int i = 0; i < pageTexts.length; i++) {
      pages.add(PageText.nativeText(i, pageTexts[i]));
    }
    return ExtractedDocument.of(SourceDocument.of("Doc.pdf", new byte[0]), pages, Map.of());
  }

  private static String words(int from, int count) {
    return IntStream.range(from, from + count)
        .mapToObj(i -> "w" + i)
        .collect(Collectors.joining(" "));
  }

  @Nested
  @DisplayName("Window and overlap")
  class WindowAndOverlap {

    @Test
    @DisplayName("Should emit overlapping windows of the configured size")
    void shouldEmitOverlappingWindows() {
      TokenWindowChunker chunker = new TokenWindowChunker(WORDS, 5, 2, 512, 0.2);

      List<TextChunk> chunks = chunker.chunk(document("a b c d e f g h i j k l"));

      assertThat(chunks)
          .extracting(TextChunk::text)
          .containsExactly("a b c d e", "d e f g h", "g h i j k", "j k l");
      assertThat(chunks).extracting(TextChunk::tokenCount).containsExactly(5, 5, 5, 3);
    }

    @Test
    @DisplayName("Should not overlap when overlap is zero")
    void shouldNotOverlapWithZeroOverlap() {
      TokenWindowChunker chunker = new TokenWindowChunker(WORDS, 4, 0, 512, 0.0);

      List<TextChunk> chunks = chunker.chunk(document("a b c d e f g h i j"));

      assertThat(chunks).extracting(TextChunk::text).containsExactly("a b c d", "e f g h", "i j");
    }

    @Test
    @DisplayName("Should never exceed the max token ceiling")
    void shouldRespectCeiling() {
      TokenWindowChunker chunker = new TokenWindowChunker(WORDS, 300, 5, 20, 0.2);

      List<TextChunk> chunks = chunker.chunk(document(words(0, 500)));

      assertThat(chunks).isNotEmpty();
      assertThat(chunks).allSatisfy(c -> assertThat(c.tokenCount()).isLessThanOrEqualTo(20));
    }

    @Test
    @DisplayName("Should return a single chunk when the text fits")
    void shouldReturnSingleChunk() {
      TokenWindowChunker chunker = new TokenWindowChunker(WORDS, 300, 50, 512, 0.2);

      List<TextChunk> chunks = chunker.chunk(document("Short document text."));

      assertThat(chunks).hasSize(1);
      assertThat(chunks.get(0).text()).isEqualTo("Short document text.");
      assertThat(chunks.get(0).id()).isEqualTo("doc_chunk_001");
    }
  }

  @Nested
  @DisplayName("Boundaries")
  class Boundaries {

    @Test
    @DisplayName("Should prefer a paragraph break inside the tolerance band")
    void shouldPreferParagraphBreak() {
      TokenWindowChunker chunker = new TokenWindowChunker(WORDS, 10, 0, 512, 0.2);

      List<TextChunk> chunks = chunker.chunk(document(words(0, 9) + "\n\n" + words(9, 6)));

      assertThat(chunks.get(0).text()).isEqualTo(words(0, 9));
    }

    @Test
    @DisplayName("Should prefer a sentence end inside the tolerance band")
    void shouldPreferSentenceEnd() {
      TokenWindowChunker chunker = new TokenWindowChunker(WORDS, 10, 0, 512, 0.2);

      List<TextChunk> chunks = chunker.chunk(document(words(0, 8) + ". " + words(8, 8)));

      assertThat(chunks.get(0).text()).isEqualTo(words(0, 8) + ".");
    }

    @Test
    @DisplayName("Should ignore a break below the tolerance band")
    void shouldIgnoreEarlyBreak() {
      TokenWindowChunker chunker = new TokenWindowChunker(WORDS, 10, 0, 512, 0.2);

      List<TextChunk> chunks = chunker.chunk(document(words(0, 3) + ". " + words(3, 12)));

      assertThat(chunks.get(0).tokenCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should cut a word that alone exceeds the window")
    void shouldCutOversizedWord() {
      TokenWindowChunker chunker = new TokenWindowChunker(CHARS, 10, 2, 512, 0.2);

      List<TextChunk> chunks = chunker.chunk(document("x".repeat(25)));

      assertThat(chunks).extracting(TextChunk::text).containsExactly(
          "x".repeat(10), "x".repeat(10), "x".repeat(5));
      assertThat(chunks).allSatisfy(c -> assertThat(c.tokenCount()).isLessThanOrEqualTo(10));
    }
  }

  @Nested
  @DisplayName("Provenance")
  class Provenance {

    @Test
    @DisplayName("Chunk text should be the document substring at its offsets")
    void shouldBeSubstringOfDocument() {
      ExtractedDocument document = document(words(0, 40), words(40, 40));
      TokenWindowChunker chunker = new TokenWindowChunker(WORDS, 15, 3, 512, 0.2);

      List<TextChunk> chunks = chunker.chunk(document);

      assertThat(chunks)
          .allSatisfy(
              c ->
                  assertThat(c.text())
                      .isEqualTo(document.text().substring(c.startOffset(), c.endOffset())));
      assertThat(chunks).extracting(TextChunk::ordinal).containsExactlyElementsOf(
          IntStream.range(0, chunks.size()).boxed().toList());
    }

    @Test
    @DisplayName("Should cover every word of the document")
    void shouldCoverEveryWord() {
      ExtractedDocument document = document(words(0, 97));
      TokenWindowChunker chunker = new TokenWindowChunker(WORDS, 10, 3, 512, 0.2);

      List<TextChunk> chunks = chunker.chunk(document);

      assertThat(chunks.get(0).startOffset()).isZero();
      assertThat(chunks.get(chunks.size() - 1).endOffset()).isEqualTo(document.text().length());
      for (int i = 1; i < chunks.size(); i++) {
        assertThat(chunks.get(i).startOffset()).isLessThanOrEqualTo(chunks.get(i - 1).endOffset());
        assertThat(chunks.get(i).endOffset()).isGreaterThan(chunks.get(i - 1).endOffset());
      }
    }

    @Test
    @DisplayName("Should record the pages a chunk spans")
    void shouldRecordPages() {
      ExtractedDocument document = document(words(0, 6), words(6, 6));
      TokenWindowChunker chunker = new TokenWindowChunker(WORDS, 8, 0, 512, 0.0);

      List<TextChunk> chunks = chunker.chunk(document);

      assertThat(chunks.get(0).firstPage()).isZero();
      assertThat(chunks.get(0).lastPage()).isEqualTo(1);
      assertThat(chunks.get(1).firstPage()).isEqualTo(1);
      assertThat(chunks.get(1).lastPage()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should be deterministic")
    void shouldBeDeterministic() {
      ExtractedDocument document = document(words(0, 200));
      TokenWindowChunker chunker = new TokenWindowChunker(WORDS, 30, 5, 512, 0.2);

      assertThat(chunker.chunk(document)).isEqualTo(chunker.chunk(document));
    }
  }

  @Test
  @DisplayName("Should return no chunks for blank text")
  void shouldReturnNothingForBlankText() {
    TokenWindowChunker chunker = new TokenWindowChunker(WORDS, 300, 50, 512, 0.2);

    assertThat(chunker.chunk(document("", "   "))).isEmpty();
  }

  @Test
  @DisplayName("Should reject an overlap not smaller than the window")
  void shouldRejectOversizedOverlap() {
    assertThatThrownBy(() -> new TokenWindowChunker(WORDS, 10, 10, 512, 0.2))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new TokenWindowChunker(WORDS, 300, 50, 40, 0.2))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
