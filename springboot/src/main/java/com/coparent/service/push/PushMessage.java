package com.coparent.service.push;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PushMessage {
    private List<String> tokens;
    private String title;
    private String body;
    private Map<String, String> data;
}
