package dev.verity.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class ModeTest {

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"  ", "normal", "NORMAL", " Normal "})
  void missingOrNormalSelectsNormal(String raw) {
    assertThat(Mode.parse(raw)).isEqualTo(Mode.NORMAL);
  }

  @Test
  void parsesStrictCaseInsensitively() {
    assertThat(Mode.parse("Strict")).isEqualTo(Mode.STRICT);
  }

  @Test
  void unknownModeIsRejected() {
    assertThatThrownBy(() -> Mode.parse("paranoid"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown mode: paranoid");
  }
}
