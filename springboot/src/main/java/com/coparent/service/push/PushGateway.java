package com.coparent.service.push;

public interface PushGateway {

    /**
     * @throws PushDeliveryException when the gateway could not be reached or refused the batch
     */
    PushResult send(PushMessage message);
}
