package com.example.collab.dto;

import java.time.Duration;
import lombok.Data;

@Data
public class CreateInviteRequest {

    /**
     * ISO-8601 duration such as {@code PT24H}; omitted means the configured default.
     */
    private Duration expiresIn;
}
