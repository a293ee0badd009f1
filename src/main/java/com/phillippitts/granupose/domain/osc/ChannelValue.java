package com.phillippitts.granupose.domain.osc;

/** One channel update of a channel batch. */
public record ChannelValue(int channel, double value) {
}
