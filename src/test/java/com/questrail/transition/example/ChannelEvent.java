package com.questrail.transition.example;

import com.questrail.transition.api.Event;

/**
 * Example domain events.
 */
public sealed interface ChannelEvent extends Event
        permits ChannelEvent.ChannelOpened, ChannelEvent.Deposited, ChannelEvent.Withdrawn,
                ChannelEvent.WithdrawRejected, ChannelEvent.ChannelSettled, ChannelEvent.ChannelClosed
{
    record ChannelOpened(String channelId, long balance) implements ChannelEvent {}

    record Deposited(long amount, long balance) implements ChannelEvent {}

    record Withdrawn(long amount, long balance) implements ChannelEvent {}

    record WithdrawRejected(long amount, long balance) implements ChannelEvent {}

    record ChannelSettled(String channelId, long finalBalance) implements ChannelEvent {}

    record ChannelClosed(String channelId) implements ChannelEvent {}
}
