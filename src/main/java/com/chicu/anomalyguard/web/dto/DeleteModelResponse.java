package com.chicu.anomalyguard.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeleteModelResponse {

    private boolean success;
    private String deviceId;
    private String message;

    public static DeleteModelResponse success(String deviceId, String msg) {
        return new DeleteModelResponse(true, deviceId, msg);
    }

    public static DeleteModelResponse error(String deviceId, String msg) {
        return new DeleteModelResponse(false, deviceId, msg);
    }
}
