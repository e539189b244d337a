package com.purchasingpower.tutor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageRequest {

    private String message;

    /**
     * Extra context given to the provider for this turn only, never stored.
     */
    private String context;

    private CollaborativeSettings collaborativeSettings;
}
