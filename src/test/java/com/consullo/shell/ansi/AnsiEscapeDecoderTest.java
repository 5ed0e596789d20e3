package com.consullo.shell.ansi;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for SGR decoding.
 *
 * @since 1.0
 */
public class AnsiEscapeDecoderTest {

  private static final String ESC = "\u001b";

  @Test
  @DisplayName("Should signal no decoration for plain text and return it as a single run")
  void decode_PlainText_SingleUndecoratedRun() {
    for (String chunk : List.of("", "hello", "C:\\work> dir", "tab\tand\nnewline")) {
      final DecodedChunk decoded = AnsiEscapeDecoder.decode(chunk);

      assertThat(decoded.decorated()).isFalse();
      assertThat(decoded.runs()).hasSize(1);
      assertThat(decoded.runs().get(0).text()).isEqualTo(chunk);
      assertThat(decoded.runs().get(0).foreground()).isNull();
    }
  }

  @Test
  @DisplayName("Should reproduce the chunk without escape sequences when runs are concatenated")
  void decode_AlternatingTextAndSgr_ConcatenationStripsEscapes() {
    final List<String[]> cases = List.of(
        new String[]{ESC + "[31mred" + ESC + "[0m plain", "red plain"},
        new String[]{"a" + ESC + "[1;32mb" + ESC + "[mc", "abc"},
        new String[]{ESC + "[91m" + ESC + "[94m", ""},
        new String[]{"x" + ESC + "[;;33;m" + "y" + ESC + "[39mz", "xyz"},
        new String[]{"PS " + ESC + "[32mC:\\work" + ESC + "[0m> ", "PS C:\\work> "});

    for (String[] c : cases) {
      final DecodedChunk decoded = AnsiEscapeDecoder.decode(c[0]);
      assertThat(decoded.decorated()).isTrue();
      assertThat(decoded.plainText()).isEqualTo(c[1]);
      assertThat(AnsiEscapeDecoder.strip(c[0])).isEqualTo(c[1]);
    }
  }

  @Test
  @DisplayName("Should map palette codes to foreground colors and reset on 0")
  void decode_ColorCodes_SetAndResetForeground() {
    final DecodedChunk decoded = AnsiEscapeDecoder.decode(
        "lead" + ESC + "[31mred" + ESC + "[92mgreen" + ESC + "[0mplain");

    final List<StyledRun> runs = decoded.runs();
    assertThat(runs).extracting(StyledRun::text).containsExactly("lead", "red", "green", "plain");
    assertThat(runs.get(0).foreground()).isNull();
    assertThat(runs.get(0).reset()).isFalse();
    assertThat(runs.get(1).foreground()).isEqualTo(AnsiPalette.foreground(31));
    assertThat(runs.get(2).foreground()).isEqualTo(AnsiPalette.foreground(92));
    assertThat(runs.get(3).foreground()).isNull();
    assertThat(runs.get(3).reset()).isTrue();
    assertThat(decoded.endFormat()).isEqualTo(TextFormat.RESET);
  }

  @Test
  @DisplayName("Should ignore unrecognized SGR codes")
  void decode_UnrecognizedCodes_KeepCurrentFormat() {
    final DecodedChunk decoded = AnsiEscapeDecoder.decode(
        ESC + "[34mblue" + ESC + "[1;4;45;9999mstill blue");

    assertThat(decoded.runs()).hasSize(2);
    assertThat(decoded.runs().get(1).foreground()).isEqualTo(AnsiPalette.foreground(34));
  }

  @Test
  @DisplayName("Should read zero-padded parameters by their numeric value")
  void decode_ZeroPaddedCodes_ReadAsNumbers() {
    final DecodedChunk decoded = AnsiEscapeDecoder.decode(
        ESC + "[31mred" + ESC + "[0000mplain" + ESC + "[00032mgreen");

    assertThat(decoded.runs()).extracting(StyledRun::text).containsExactly("red", "plain", "green");
    assertThat(decoded.runs().get(1).foreground()).isNull();
    assertThat(decoded.runs().get(1).reset()).isTrue();
    assertThat(decoded.runs().get(2).foreground()).isEqualTo(AnsiPalette.foreground(32));
  }

  @Test
  @DisplayName("Should paint uncolored runs with the default foreground")
  void displayForeground_NoColor_DefaultForeground() {
    final DecodedChunk decoded = AnsiEscapeDecoder.decode("plain" + ESC + "[35mmagenta" + ESC + "[39mdefault");

    assertThat(decoded.runs()).extracting(StyledRun::displayForeground).containsExactly(
        AnsiPalette.DEFAULT_FOREGROUND, AnsiPalette.foreground(35), AnsiPalette.DEFAULT_FOREGROUND);
  }

  @Test
  @DisplayName("Should leave non-SGR escape sequences in the text")
  void decode_NonSgrEscape_LeftAsText() {
    final String clearLine = ESC + "[2K" + "progress";

    final DecodedChunk decoded = AnsiEscapeDecoder.decode(clearLine);

    assertThat(decoded.decorated()).isFalse();
    assertThat(decoded.plainText()).isEqualTo(clearLine);
  }

  @Test
  @DisplayName("Should carry the starting format into the first run")
  void decode_StartFormat_AppliesToLeadingText() {
    final DecodedChunk first = AnsiEscapeDecoder.decode("a" + ESC + "[36mb");
    final DecodedChunk second = AnsiEscapeDecoder.decode("c" + ESC + "[0md", first.endFormat());

    assertThat(second.runs().get(0).text()).isEqualTo("c");
    assertThat(second.runs().get(0).foreground()).isEqualTo(AnsiPalette.foreground(36));
    assertThat(second.runs().get(1).reset()).isTrue();

    final DecodedChunk plain = AnsiEscapeDecoder.decode("e", first.endFormat());
    assertThat(plain.decorated()).isFalse();
    assertThat(plain.runs().get(0).foreground()).isEqualTo(AnsiPalette.foreground(36));
  }

  @Test
  @DisplayName("Should produce identical runs for identical input")
  void decode_SameInput_Deterministic() {
    final String chunk = "x" + ESC + "[33my" + ESC + "[0mz";

    assertThat(AnsiEscapeDecoder.decode(chunk)).isEqualTo(AnsiEscapeDecoder.decode(chunk));
  }

  @Test
  @DisplayName("Should treat an unterminated sequence as text")
  void decode_UnterminatedSequence_LeftAsText() {
    final String chunk = "ok" + ESC + "[31";

    final DecodedChunk decoded = AnsiEscapeDecoder.decode(chunk);

    assertThat(decoded.decorated()).isFalse();
    assertThat(decoded.plainText()).isEqualTo(chunk);
  }

  @Test
  @DisplayName("Should reject null input")
  void decode_Null_Rejected() {
    assertThatThrownBy(() -> AnsiEscapeDecoder.decode(null)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should expose only recognized palette codes")
  void palette_Ranges_OnlyRecognizedCodes() {
    assertThat(AnsiPalette.foreground(30)).isNotNull();
    assertThat(AnsiPalette.foreground(37)).isNotNull();
    assertThat(AnsiPalette.foreground(90)).isNotNull();
    assertThat(AnsiPalette.foreground(97)).isNotNull();
    assertThat(AnsiPalette.foreground(38)).isNull();
    assertThat(AnsiPalette.foreground(89)).isNull();
    assertThat(AnsiPalette.foreground(98)).isNull();
  }
}
