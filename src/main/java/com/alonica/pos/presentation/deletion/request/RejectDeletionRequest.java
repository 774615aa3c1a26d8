package com.alonica.pos.presentation.deletion.request;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RejectDeletionRequest {
    private String reason;
}
