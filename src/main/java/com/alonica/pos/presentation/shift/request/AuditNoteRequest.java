package com.alonica.pos.presentation.shift.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AuditNoteRequest {
    @NotBlank(message = "감사 메모는 필수입니다")
    private String note;
}
