package com.example.ip_provisioner.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ArtifactHeaderTest {

  @Test
  void rendersCommentBlock() {
    final ArtifactHeader header =
        new ArtifactHeader(
            ArtifactKind.RESTORE, "us-east-1", Instant.parse("2024-05-01T10:15:30Z"), 12);

    assertThat(header.toCommentLines())
        .containsExactly(
            "-- ip-provisioner artifact",
            "-- Kind: RESTORE",
            "-- Region: us-east-1",
            "-- Captured-At: 2024-05-01T10:15:30Z",
            "-- Record-Count: 12");
  }

  @Test
  void missingFieldIsRejected() {
    assertThatThrownBy(
            () -> ArtifactHeader.fromFields(Map.of("Kind", "RESTORE", "Region", "us-east-1")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Captured-At");
  }

  @Test
  void malformedFieldIsRejected() {
    assertThatThrownBy(
            () ->
                ArtifactHeader.fromFields(
                    Map.of(
                        "Kind", "SNAPSHOT",
                        "Region", "us-east-1",
                        "Captured-At", "2024-05-01T10:15:30Z",
                        "Record-Count", "3")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("malformed");
  }
}
