package io.b2mash.commerce.pricing;

import io.b2mash.commerce.catalog.StoreItem;
import java.util.UUID;

/** A cart line to be priced. {@code item} is null when the product no longer exists. */
public record PricingLine(UUID productId, int quantity, StoreItem item) {}
