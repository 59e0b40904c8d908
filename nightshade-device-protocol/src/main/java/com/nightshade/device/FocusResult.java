package com.nightshade.device;

public record FocusResult(int position, double hfr) {
}
