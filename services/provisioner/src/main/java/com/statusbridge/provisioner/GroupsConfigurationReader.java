package com.statusbridge.provisioner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the service-to-group mapping:
 *
 * <pre>
 * { "groups_configuration": [
 *     { "status_page_group": "Core Services", "status_page_components": ["Web", "API"] } ] }
 * </pre>
 */
public class GroupsConfigurationReader {

    private static final Logger log = LoggerFactory.getLogger(GroupsConfigurationReader.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GroupsDocument(@JsonProperty("groups_configuration") List<GroupEntry> groups) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GroupEntry(
            @JsonProperty("status_page_group") String group,
            @JsonProperty("status_page_components") List<String> components) {}

    private final ObjectMapper objectMapper;

    public GroupsConfigurationReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return service name to group name, in document order; a service listed twice keeps its
     *         last group
     */
    public Map<String, String> read(Path file) {
        GroupsDocument document;
        try {
            document = objectMapper.readValue(Files.readString(file), GroupsDocument.class);
        } catch (NoSuchFileException e) {
            throw new InvalidProvisioningInputException("Groups file not found: " + file, e);
        } catch (IOException e) {
            throw new InvalidProvisioningInputException("Cannot parse groups file " + file + ": " + e.getMessage(), e);
        }
        Map<String, String> serviceToGroup = new LinkedHashMap<>();
        if (document == null || document.groups() == null) {
            log.warn("Groups file {} has no groups_configuration entries", file);
            return serviceToGroup;
        }
        for (GroupEntry entry : document.groups()) {
            if (entry == null || entry.group() == null || entry.group().isBlank() || entry.components() == null) {
                continue;
            }
            for (String service : entry.components()) {
                if (service == null || service.isBlank()) {
                    continue;
                }
                String previous = serviceToGroup.put(service.strip(), entry.group().strip());
                if (previous != null && !previous.equals(entry.group().strip())) {
                    log.warn("Service '{}' is mapped to both '{}' and '{}', using the latter",
                            service, previous, entry.group());
                }
            }
        }
        return serviceToGroup;
    }
}
