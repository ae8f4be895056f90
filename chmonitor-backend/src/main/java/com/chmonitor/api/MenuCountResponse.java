package com.chmonitor.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Badge count for a navigation entry; {@code count} is {@code null} when an optional table is absent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MenuCountResponse {
    private Long count;
}
