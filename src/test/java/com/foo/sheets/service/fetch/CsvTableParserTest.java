package com.foo.sheets.service.fetch;

import static org.assertj.core.api.Assertions.assertThat;

import com.foo.sheets.model.SheetDataset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CsvTableParserTest {

  private CsvTableParser parser;

  @BeforeEach
  void setUp() {
    parser = new CsvTableParser();
  }

  @Test
  void parse_emptyText_returnsEmptyDataset() {
    SheetDataset dataset = parser.parse("");

    assertThat(dataset.headers()).isEmpty();
    assertThat(dataset.rows()).isEmpty();
  }

  @Test
  void parse_headersAreTrimmed() {
    SheetDataset dataset = parser.parse(" Program , Company ,CBR (%)\nA,X,10%\n");

    assertThat(dataset.headers()).containsExactly("Program", "Company", "CBR (%)");
  }

  @Test
  void parse_rowsArePaddedOrTruncatedToHeaderLength() {
    SheetDataset dataset = parser.parse("a,b,c\n1\n1,2,3,4,5\n1,2,3\n");

    assertThat(dataset.rows()).containsExactly(
        List.of("1", "", ""),
        List.of("1", "2", "3"),
        List.of("1", "2", "3"));
    assertThat(dataset.rows()).allSatisfy(row -> assertThat(row).hasSize(3));
  }

  @Test
  void parse_blankRows_skipped() {
    SheetDataset dataset = parser.parse("a,b\n,\n1,2\n\n  ,  \n3,4\n");

    assertThat(dataset.rows()).containsExactly(List.of("1", "2"), List.of("3", "4"));
  }

  @Test
  void parse_dataCellsAreNotTrimmed() {
    SheetDataset dataset = parser.parse("a,b\n x ,2\n");

    assertThat(dataset.rows().get(0)).containsExactly(" x ", "2");
  }

  @Test
  void parse_quotedFields() {
    SheetDataset dataset =
        parser.parse("name,note\n\"Kim, J\",\"said \"\"hi\"\"\"\nplain,C:\\tmp\n");

    assertThat(dataset.rows()).containsExactly(
        List.of("Kim, J", "said \"hi\""),
        List.of("plain", "C:\\tmp"));
  }

  @Test
  void parse_invalidUtf8_isReplaced() {
    byte[] body = "a,b\nx,".getBytes(StandardCharsets.UTF_8);
    byte[] withBadByte = new byte[body.length + 1];
    System.arraycopy(body, 0, withBadByte, 0, body.length);
    withBadByte[body.length] = (byte) 0xFF;

    SheetDataset dataset = parser.parse(withBadByte);

    assertThat(dataset.rows()).containsExactly(List.of("x", "\uFFFD"));
  }

  @Test
  void parse_textAfterClosingQuote_isAppendedToField() {
    SheetDataset dataset = parser.parse("a,b\n\"ab\"cd,2\n3,4\n");

    assertThat(dataset.rows()).containsExactly(List.of("abcd", "2"), List.of("3", "4"));
  }

  @Test
  void parse_unterminatedQuoteAtEnd_keepsCollectedText() {
    SheetDataset dataset = parser.parse("a,b\nx,y\n\"abc,1\n");

    assertThat(dataset.rows()).containsExactly(List.of("x", "y"), List.of("abc,1\n", ""));
  }

  @Test
  void parse_leniently_quoteInsideUnquotedFieldIsLiteral() {
    SheetDataset dataset = parser.parse("size,qty\n5\" pipe,2\n\"bad\"x,3\n");

    assertThat(dataset.rows()).containsExactly(List.of("5\" pipe", "2"), List.of("badx", "3"));
  }

  @Test
  void parse_nonBreakingSpaceRow_isBlank() {
    SheetDataset dataset = parser.parse("\u00a0a\u00a0,b\n\u00a0,\u202f\n1,2\n");

    assertThat(dataset.headers()).containsExactly("a", "b");
    assertThat(dataset.rows()).containsExactly(List.of("1", "2"));
  }

  @Test
  void parse_headerOnly_returnsNoRows() {
    SheetDataset dataset = parser.parse("a,b,c\n");

    assertThat(dataset.headers()).hasSize(3);
    assertThat(dataset.rows()).isEmpty();
  }
}
