package com.example.safespace.generation;

import com.example.safespace.model.IncidentDetails;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Fixed user prompt for complaint form narratives. Field values are embedded verbatim. */
public final class ReportPrompts {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(.*?)}}");

  static final String USER_TEMPLATE = """
          Berdasarkan informasi berikut, buatkan FORMULIR PENGADUAN KEKERASAN SEKSUAL yang lengkap dan formal:

          Lokasi Kejadian: {{location}}
          Identitas Pelaku: {{perpetrator}}
          Jenis Kekerasan: {{description}}
          Bukti Tersedia: {{evidence}}
          Tujuan Pelapor: {{user_goal}}

          Buatkan formulir lengkap dengan struktur:
          1. IDENTIFIKASI KEBUTUHAN
          2. IDENTIFIKASI PELAKU
          3. KRONOLOGI KEJADIAN (menggunakan sudut pandang "Saya")
          4. BUKTI TERLAMPIR

          Pastikan narasi tertulis dalam bahasa Indonesia formal dan siap untuk diajukan ke otoritas.""";

  private ReportPrompts() {}

  public static String userPrompt(IncidentDetails details) {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("location", details.location().value());
    values.put("perpetrator", details.perpetrator().value());
    values.put("description", details.description().value());
    values.put("evidence", details.evidence().value());
    values.put("user_goal", details.userGoal().value());
    return render(USER_TEMPLATE, values);
  }

  static String render(String template, Map<String, String> values) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String key = matcher.group(1).trim();
      matcher.appendReplacement(out, Matcher.quoteReplacement(values.getOrDefault(key, "")));
    }
    matcher.appendTail(out);
    return out.toString();
  }
}
