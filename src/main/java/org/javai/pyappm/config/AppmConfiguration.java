package org.javai.pyappm.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Contents of the tool configuration file: the tool settings plus every tracked application.
 * Application names are unique.
 */
public record AppmConfiguration(AppmSettings settings, List<AppmApplication> applications) {

	public AppmConfiguration {
		settings = settings != null ? settings : AppmSettings.defaults();
		applications = applications != null ? List.copyOf(applications) : List.of();
		Set<String> names = new HashSet<>();
		for (AppmApplication application : applications) {
			if (!names.add(application.name())) {
				throw new IllegalArgumentException("Duplicate application name: " + application.name());
			}
		}
	}

	public static AppmConfiguration defaults() {
		return new AppmConfiguration(AppmSettings.defaults(), List.of());
	}

	public Optional<AppmApplication> application(String name) {
		return applications.stream().filter(app -> app.name().equals(name)).findFirst();
	}

	/**
	 * Adds the application, replacing one with the same name in place.
	 */
	public AppmConfiguration withApplication(AppmApplication application) {
		List<AppmApplication> updated = new ArrayList<>(applications);
		int index = -1;
		for (int i = 0; i < updated.size(); i++) {
			if (updated.get(i).name().equals(application.name())) {
				index = i;
				break;
			}
		}
		if (index >= 0) {
			updated.set(index, application);
		}
		else {
			updated.add(application);
		}
		return new AppmConfiguration(settings, updated);
	}

	public AppmConfiguration withoutApplication(String name) {
		return new AppmConfiguration(settings,
				applications.stream().filter(app -> !app.name().equals(name)).toList());
	}
}
