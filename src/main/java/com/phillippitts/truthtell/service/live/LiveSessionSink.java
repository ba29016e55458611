package com.phillippitts.truthtell.service.live;

import com.phillippitts.truthtell.exception.SinkException;
import com.phillippitts.truthtell.service.live.message.OutboundMessage;

/**
 * Outbound channel of one live session, typically the client's WebSocket connection.
 */
public interface LiveSessionSink {

    /**
     * Delivers one message.
     *
     * @throws SinkException if the message cannot be delivered (e.g. the connection is closed)
     */
    void send(OutboundMessage message);

    boolean isOpen();
}
