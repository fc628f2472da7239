package com.questrail.sandnet.transport.netty;

import com.questrail.sandnet.errors.TransportException;
import com.questrail.sandnet.errors.WouldBlockException;
import com.questrail.sandnet.transport.AcceptedConnection;
import com.questrail.sandnet.transport.RawListener;

import io.netty.channel.Channel;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * {@link RawListener} over a Netty server channel. Child channels are queued
 * by the channel initializer as they arrive and handed out by
 * {@link #accept()}.
 */
final class NettyListener implements RawListener
{
    private final Queue<AcceptedConnection> pending = new ConcurrentLinkedQueue<>();
    private volatile Channel serverChannel;

    void bound(Channel serverChannel)
    {
        this.serverChannel = serverChannel;
    }

    void enqueue(AcceptedConnection connection)
    {
        pending.add(connection);
    }

    @Override
    public AcceptedConnection accept()
    {
        AcceptedConnection next = pending.poll();
        if (next != null) {
            return next;
        }
        Channel ch = serverChannel;
        if (ch == null || !ch.isOpen()) {
            throw new TransportException("listening channel is closed");
        }
        throw new WouldBlockException("no pending connection");
    }

    @Override
    public void close()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close();
        }
        // connections nobody accepted
        for (AcceptedConnection c = pending.poll(); c != null; c = pending.poll()) {
            c.connection().close();
        }
    }
}
