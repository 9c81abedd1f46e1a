package com.example.safespace.validation;

import com.example.safespace.error.ValidationException;
import com.example.safespace.model.EvidenceType;
import com.example.safespace.model.IncidentCategory;
import com.example.safespace.model.IncidentDetails;
import com.example.safespace.model.IncidentLocation;
import com.example.safespace.model.IncidentType;
import com.example.safespace.model.PerpetratorType;
import com.example.safespace.model.UserGoal;
import com.example.safespace.request.ReportRequest;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Maps the raw report payload onto the closed incident categories. Every invalid field is
 * reported at once.
 */
@Component
public class IncidentDetailsValidator {

  public IncidentDetails validate(ReportRequest request) {
    if (request == null) {
      throw new ValidationException("Report payload is required.");
    }
    List<String> reasons = new ArrayList<>();
    IncidentLocation location = parse(IncidentLocation.class, "location", request.location(), reasons);
    PerpetratorType perpetrator = parse(PerpetratorType.class, "perpetrator", request.perpetrator(), reasons);
    IncidentType description = parse(IncidentType.class, "description", request.description(), reasons);
    EvidenceType evidence = parse(EvidenceType.class, "evidence", request.evidence(), reasons);
    UserGoal userGoal = parse(UserGoal.class, "user_goal", request.userGoal(), reasons);

    if (!reasons.isEmpty()) {
      throw new ValidationException(reasons);
    }
    return new IncidentDetails(location, perpetrator, description, evidence, userGoal);
  }

  private <E extends Enum<E> & IncidentCategory> E parse(
      Class<E> type, String field, String raw, List<String> reasons) {
    if (raw == null || raw.isBlank()) {
      reasons.add(field + " is required.");
      return null;
    }
    return IncidentCategory.fromValue(type, raw)
        .orElseGet(() -> {
          reasons.add("%s must be one of %s (got '%s')."
              .formatted(field, IncidentCategory.allowedValues(type), raw));
          return null;
        });
  }
}
