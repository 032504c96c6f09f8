package com.zplat.ipld.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class DryRunStatusResponse {
    @JsonProperty("firewall_rules")
    String firewallRules;
    @JsonProperty("check_ssh_login")
    String checkSshLogin;
    @JsonProperty("check_dataset_access")
    String checkDatasetAccess;
    @JsonProperty("check_tmp_space")
    String checkTmpSpace;
}
