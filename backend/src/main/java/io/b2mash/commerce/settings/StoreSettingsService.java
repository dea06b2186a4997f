package io.b2mash.commerce.settings;

import io.b2mash.commerce.catalog.DiscountType;
import io.b2mash.commerce.pricing.GlobalDiscount;
import java.math.BigDecimal;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Reads store-wide settings maintained by store administrators. */
@Service
public class StoreSettingsService {

  private static final Logger log = LoggerFactory.getLogger(StoreSettingsService.class);

  public static final String GLOBAL_DISCOUNT_KEY = "STORE_GLOBAL_DISCOUNT";

  private final StoreSettingRepository storeSettingRepository;

  public StoreSettingsService(StoreSettingRepository storeSettingRepository) {
    this.storeSettingRepository = storeSettingRepository;
  }

  @Transactional(readOnly = true)
  public GlobalDiscount getGlobalDiscount() {
    return storeSettingRepository
        .findById(GLOBAL_DISCOUNT_KEY)
        .map(setting -> toGlobalDiscount(setting.getValue()))
        .orElse(GlobalDiscount.none());
  }

  static GlobalDiscount toGlobalDiscount(Map<String, Object> value) {
    try {
      boolean active = Boolean.parseBoolean(String.valueOf(value.getOrDefault("active", false)));
      var type = DiscountType.valueOf(String.valueOf(value.getOrDefault("type", "NONE")));
      return new GlobalDiscount(
          active,
          type,
          decimal(value.get("value")),
          decimal(value.get("minOrderTotal")),
          value.get("label") != null ? String.valueOf(value.get("label")) : null);
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring malformed {} setting: {}", GLOBAL_DISCOUNT_KEY, e.getMessage());
      return GlobalDiscount.none();
    }
  }

  private static BigDecimal decimal(Object raw) {
    return raw == null ? BigDecimal.ZERO : new BigDecimal(String.valueOf(raw));
  }
}
