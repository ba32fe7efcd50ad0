package org.whiteelephant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

// corps de pick / steal ; présence vérifiée par le contrôleur selon l'action
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PlayRequest {
    @Positive
    @JsonProperty("present_id")
    private Long presentId;
}
