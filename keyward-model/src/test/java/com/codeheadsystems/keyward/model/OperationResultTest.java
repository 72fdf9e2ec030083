package com.codeheadsystems.keyward.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keyward.model.error.ErrorKind;
import com.codeheadsystems.keyward.model.error.KeywardException;
import org.junit.jupiter.api.Test;

class OperationResultTest {

  @Test
  void ok_exposesValue() {
    OperationResult<String> result = OperationResult.ok("fp");
    assertThat(result.success()).isTrue();
    assertThat(result.asOptional()).contains("fp");
    assertThat(result.orElseThrow()).isEqualTo("fp");
  }

  @Test
  void failure_fromException_keepsKindAndMessage() {
    OperationResult<String> result = OperationResult.failure(KeywardException.keyNotFound("ABCD"));

    assertThat(result.success()).isFalse();
    assertThat(result.errorKind()).isEqualTo(ErrorKind.KEY_NOT_FOUND);
    assertThat(result.error()).contains("ABCD");
    assertThat(result.asOptional()).isEmpty();
    assertThatThrownBy(result::orElseThrow)
        .isInstanceOf(KeywardException.class)
        .extracting(e -> ((KeywardException) e).kind())
        .isEqualTo(ErrorKind.KEY_NOT_FOUND);
  }
}
