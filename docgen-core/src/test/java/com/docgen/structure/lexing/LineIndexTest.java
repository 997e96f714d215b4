package com.docgen.structure.lexing;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LineIndexTest {

  private final LineIndex index = new LineIndex("ab\ncd\n\nef");

  @Test
  void countsLinesIncludingEmptyOnes() {
    assertThat(index.lineCount()).isEqualTo(4);
    assertThat(index.lineText(0)).isEqualTo("ab");
    assertThat(index.lineText(2)).isEmpty();
    assertThat(index.lineText(3)).isEqualTo("ef");
    assertThat(new LineIndex("").lineCount()).isEqualTo(1);
  }

  @Test
  void mapsOffsetsToLineAndColumn() {
    assertThat(index.toLineCol(0)).isEqualTo(new LineIndex.LineCol(0, 0));
    assertThat(index.toLineCol(2)).isEqualTo(new LineIndex.LineCol(0, 2));
    assertThat(index.toLineCol(3)).isEqualTo(new LineIndex.LineCol(1, 0));
    assertThat(index.toLineCol(6)).isEqualTo(new LineIndex.LineCol(2, 0));
    assertThat(index.toLineCol(9)).isEqualTo(new LineIndex.LineCol(3, 2));
  }

  @Test
  void clampsOutOfRangeCoordinates() {
    assertThat(index.toLineCol(-5)).isEqualTo(new LineIndex.LineCol(0, 0));
    assertThat(index.toLineCol(100)).isEqualTo(new LineIndex.LineCol(3, 2));
    assertThat(index.toOffset(-1, 3)).isZero();
    assertThat(index.toOffset(10, 0)).isEqualTo(9);
    assertThat(index.toOffset(0, 50)).isEqualTo(2);
  }

  @Test
  void offsetsSurviveRoundTrip() {
    String text = index.text();
    for (int offset = 0; offset <= text.length(); offset++) {
      LineIndex.LineCol position = index.toLineCol(offset);
      assertThat(index.toOffset(position.line(), position.column())).isEqualTo(offset);
    }
  }

  @Test
  void lineBoundariesExcludeTheNewline() {
    assertThat(index.lineStart(1)).isEqualTo(3);
    assertThat(index.lineEnd(1)).isEqualTo(5);
    assertThat(index.lineEnd(3)).isEqualTo(9);
    assertThat(index.lineStart(7)).isEqualTo(9);
  }
}
