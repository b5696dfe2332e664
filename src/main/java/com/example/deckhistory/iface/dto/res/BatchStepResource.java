package com.example.deckhistory.iface.dto.res;

import com.example.deckhistory.application.shared.dto.BatchStepResultData;

public record BatchStepResource(String code, String message, BatchStepResultData data) {

}
