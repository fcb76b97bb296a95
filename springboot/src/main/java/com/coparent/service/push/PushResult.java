package com.coparent.service.push;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PushResult {
    private int successCount;
    private int failureCount;

    @Builder.Default
    private List<String> invalidTokens = new ArrayList<>();

    public static PushResult empty() {
        return PushResult.builder().build();
    }
}
