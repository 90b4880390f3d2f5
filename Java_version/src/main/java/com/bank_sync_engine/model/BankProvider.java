package com.bank_sync_engine.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("bank_providers")
public class BankProvider {

    @Id
    private UUID id;

    @Column("code")
    private String code;   // COMPE code, e.g. '077', '260', '341'

    @Column("name")
    private String name;

    @Column("authorization_endpoint")
    private String authorizationEndpoint;

    @Column("token_endpoint")
    private String tokenEndpoint;

    @Column("api_base_url")
    private String apiBaseUrl;

    // Codes issued by this provider's authorize endpoint must start with it (nullable)
    @Column("authorization_code_prefix")
    private String authorizationCodePrefix;

    @Column("is_active")
    private Boolean active;
}
