package io.b2mash.commerce.settings;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "store_settings")
public class StoreSetting {

  @Id
  @Column(name = "setting_key", nullable = false, updatable = false, length = 100)
  private String key;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "setting_value", columnDefinition = "jsonb", nullable = false)
  private Map<String, Object> value = new HashMap<>();

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected StoreSetting() {}

  public StoreSetting(String key, Map<String, Object> value) {
    this.key = Objects.requireNonNull(key, "key must not be null");
    this.value = new HashMap<>(Objects.requireNonNull(value, "value must not be null"));
  }

  @PrePersist
  @PreUpdate
  void touch() {
    this.updatedAt = Instant.now();
  }

  public String getKey() {
    return key;
  }

  public Map<String, Object> getValue() {
    return value;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
