package com.ryuqq.srp.testkit.contract;

import com.ryuqq.srp.core.model.RenderedInvoice;
import com.ryuqq.srp.core.spi.InvoiceSender;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link InvoiceSender} fake that records every delivery instead of emitting it.
 *
 * <p>This implementation is used for test assertions on what the invoice workflow sent
 * and to whom.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public class RecordingInvoiceSender implements InvoiceSender {

    private final List<Delivery> deliveries = new ArrayList<>();

    @Override
    public void send(RenderedInvoice invoice, String destination) {
        if (invoice == null) {
            throw new IllegalArgumentException("invoice cannot be null");
        }
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination cannot be null or blank");
        }
        deliveries.add(new Delivery(invoice, destination));
    }

    /**
     * Returns all deliveries in send order.
     *
     * @return unmodifiable view of recorded deliveries
     */
    public List<Delivery> getDeliveries() {
        return Collections.unmodifiableList(deliveries);
    }

    /**
     * Returns the most recent delivery.
     *
     * @return last delivery
     * @throws IllegalStateException if nothing has been sent
     */
    public Delivery lastDelivery() {
        if (deliveries.isEmpty()) {
            throw new IllegalStateException("No invoice has been sent");
        }
        return deliveries.get(deliveries.size() - 1);
    }

    /**
     * Clears all recorded deliveries.
     */
    public void clear() {
        deliveries.clear();
    }

    /**
     * A single recorded delivery.
     *
     * @param invoice the rendered invoice
     * @param destination the recipient
     */
    public record Delivery(RenderedInvoice invoice, String destination) {
    }
}
