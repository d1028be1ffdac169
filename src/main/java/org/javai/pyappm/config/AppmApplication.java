package org.javai.pyappm.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * An application tracked in the tool configuration, one section per application.
 * Absent optional fields are left out of the file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "version", "description", "readme_file", "license", "license_file", "copyright",
		"author", "dependencies", "app_type", "module", "function"})
public record AppmApplication(
		@JsonProperty("name") String name,
		@JsonProperty("version") String version,
		@JsonProperty("description") String description,
		@JsonProperty("readme_file") String readmeFile,
		@JsonProperty("license") String license,
		@JsonProperty("license_file") String licenseFile,
		@JsonProperty("copyright") String copyright,
		@JsonProperty("author") String author,
		@JsonProperty("dependencies") List<String> dependencies,
		@JsonProperty("app_type") String appType,
		@JsonProperty("module") String module,
		@JsonProperty("function") String function) {

	public AppmApplication {
		version = version != null ? version : "0.1.0";
		readmeFile = readmeFile != null ? readmeFile : "README.md";
		licenseFile = licenseFile != null ? licenseFile : "LICENSE.txt";
		dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
		appType = appType != null ? appType : "application";
		function = function != null ? function : "main";
	}

	public static AppmApplication named(String name) {
		return new AppmApplication(name, null, null, null, null, null, null, null, null, null, null, null);
	}

	public AppmApplication withName(String newName) {
		return new AppmApplication(newName, version, description, readmeFile, license, licenseFile, copyright,
				author, dependencies, appType, module, function);
	}

	@Override
	public String toString() {
		return name + " v" + version;
	}
}
