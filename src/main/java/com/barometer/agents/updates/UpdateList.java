package com.barometer.agents.updates;

import java.util.List;

public record UpdateList(PackageManager manager, List<PackageUpdate> packages) {

    public UpdateList {
        packages = List.copyOf(packages);
    }

    public int count() {
        return packages.size();
    }
}
