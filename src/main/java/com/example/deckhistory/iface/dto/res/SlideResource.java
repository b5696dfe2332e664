package com.example.deckhistory.iface.dto.res;

import com.example.deckhistory.application.shared.projection.SlideStateProjection;

public record SlideResource(String code, String message, SlideStateProjection data) {

}
