package com.flamingo.ai.eventassistant.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking the assistant. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 2000, message = "Query must not exceed 2000 characters")
  private String query;
}
