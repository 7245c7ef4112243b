package com.xammer.scheduler.dto;

import com.xammer.scheduler.domain.ResourceType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResourceErrorDto {

    public enum Kind {
        DISCOVERY,
        TAG_LOOKUP,
        DRIVER
    }

    private String resourceId; // null for discovery failures
    private ResourceType resourceType;
    private Kind kind;
    private String message;
}
