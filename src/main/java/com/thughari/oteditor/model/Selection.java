package com.thughari.oteditor.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Selection {
    Position start;
    Position end;
}
