package com.planverify.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Healthcare provider identified by NPI.
 * Loaded by the directory import; read here for existence checks and specialty lookup.
 */
@Entity
@Table(name = "providers", indexes = {
    @Index(name = "idx_providers_specialty", columnList = "primary_specialty")
})
public class Provider {

    @Id
    @NotNull
    @Pattern(regexp = "\\d{10}")
    @Column(length = 10)
    private String npi;

    @Column(name = "first_name", length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    @Column(name = "organization_name", length = 200)
    private String organizationName;

    @Column(name = "primary_specialty", length = 200)
    private String primarySpecialty;

    @Column(name = "taxonomy_description", length = 200)
    private String taxonomyDescription;

    protected Provider() {}

    public static Provider individual(String npi, String firstName, String lastName,
                                      String primarySpecialty, String taxonomyDescription) {
        Provider provider = new Provider();
        provider.npi = npi;
        provider.firstName = firstName;
        provider.lastName = lastName;
        provider.primarySpecialty = primarySpecialty;
        provider.taxonomyDescription = taxonomyDescription;
        return provider;
    }

    public static Provider organization(String npi, String organizationName,
                                        String primarySpecialty, String taxonomyDescription) {
        Provider provider = new Provider();
        provider.npi = npi;
        provider.organizationName = organizationName;
        provider.primarySpecialty = primarySpecialty;
        provider.taxonomyDescription = taxonomyDescription;
        return provider;
    }

    public String getNpi() { return npi; }
    public String getFirstName() { return firstName; }
    public String getLastName() { return lastName; }
    public String getOrganizationName() { return organizationName; }
    public String getPrimarySpecialty() { return primarySpecialty; }
    public String getTaxonomyDescription() { return taxonomyDescription; }
}
