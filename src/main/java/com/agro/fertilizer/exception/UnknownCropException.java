package com.agro.fertilizer.exception;

import lombok.Getter;

@Getter
public class UnknownCropException extends BlendingException {

    private final String fieldId;
    private final String crop;

    public UnknownCropException(String fieldId, String crop) {
        super("Field '" + fieldId + "' references crop '" + crop + "' which has no requirement entry");
        this.fieldId = fieldId;
        this.crop = crop;
    }

    @Override
    public String getErrorCode() {
        return "UNKNOWN_CROP";
    }
}
