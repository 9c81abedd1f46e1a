package com.example.safespace.generation;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.safespace.model.EvidenceType;
import com.example.safespace.model.IncidentDetails;
import com.example.safespace.model.IncidentLocation;
import com.example.safespace.model.IncidentType;
import com.example.safespace.model.PerpetratorType;
import com.example.safespace.model.UserGoal;
import org.junit.jupiter.api.Test;

import java.util.Map;

class ReportPromptsTest {

  @Test
  void embedsFieldValuesVerbatim() {
    IncidentDetails details = new IncidentDetails(
        IncidentLocation.PUBLIC_SPACE,
        PerpetratorType.STRANGER,
        IncidentType.UNWANTED_PHYSICAL_TOUCH,
        EvidenceType.NONE,
        UserGoal.CONSIDER_REPORTING);

    String prompt = ReportPrompts.userPrompt(details);

    assertThat(prompt)
        .contains("Lokasi Kejadian: public space")
        .contains("Identitas Pelaku: stranger")
        .contains("Jenis Kekerasan: unwanted physical touch")
        .contains("Bukti Tersedia: none")
        .contains("Tujuan Pelapor: consider reporting")
        .doesNotContain("{{");
  }

  @Test
  void unknownPlaceholderRendersEmptyAndReplacementIsLiteral() {
    String rendered = ReportPrompts.render("a={{a}} b={{ b }}", Map.of("a", "$1\\x"));

    assertThat(rendered).isEqualTo("a=$1\\x b=");
  }
}
