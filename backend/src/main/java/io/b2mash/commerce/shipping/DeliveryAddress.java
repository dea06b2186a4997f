package io.b2mash.commerce.shipping;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "delivery_addresses")
public class DeliveryAddress {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "full_name", nullable = false, length = 255)
  private String fullName;

  @Column(name = "line1", nullable = false, length = 255)
  private String line1;

  @Column(name = "line2", length = 255)
  private String line2;

  @Column(name = "city", nullable = false, length = 120)
  private String city;

  @Column(name = "postcode", nullable = false, length = 20)
  private String postcode;

  @Column(name = "country", nullable = false, length = 2)
  private String country;

  @Column(name = "phone", length = 40)
  private String phone;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected DeliveryAddress() {}

  public DeliveryAddress(
      UUID userId,
      String fullName,
      String line1,
      String line2,
      String city,
      String postcode,
      String country,
      String phone) {
    this.userId = Objects.requireNonNull(userId, "userId must not be null");
    this.fullName = Objects.requireNonNull(fullName, "fullName must not be null");
    this.line1 = Objects.requireNonNull(line1, "line1 must not be null");
    this.line2 = line2;
    this.city = Objects.requireNonNull(city, "city must not be null");
    this.postcode = Objects.requireNonNull(postcode, "postcode must not be null");
    this.country = Objects.requireNonNull(country, "country must not be null");
    this.phone = phone;
  }

  @PrePersist
  void onCreate() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getFullName() {
    return fullName;
  }

  public String getLine1() {
    return line1;
  }

  public String getLine2() {
    return line2;
  }

  public String getCity() {
    return city;
  }

  public String getPostcode() {
    return postcode;
  }

  public String getCountry() {
    return country;
  }

  public String getPhone() {
    return phone;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
