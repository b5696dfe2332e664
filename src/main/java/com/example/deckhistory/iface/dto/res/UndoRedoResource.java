package com.example.deckhistory.iface.dto.res;

import com.example.deckhistory.application.shared.dto.UndoRedoResultData;

public record UndoRedoResource(String code, String message, UndoRedoResultData data) {

}
