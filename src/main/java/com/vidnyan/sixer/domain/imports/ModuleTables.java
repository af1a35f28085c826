package com.vidnyan.sixer.domain.imports;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Module name tables used to classify import groups.
 *
 * <p>Stdlib and application names are matched exactly, third-party entries are prefixes:
 * {@code oslo} matches {@code oslo_utils} and {@code oslo.config}.
 */
public record ModuleTables(
        Set<String> stdlibModules,
        List<String> thirdPartyPrefixes,
        Set<String> applicationModules) {

    private static final Set<String> STDLIB = Set.of(
            "StringIO", "copy", "csv", "datetime", "glob", "heapq", "importlib",
            "itertools", "json", "logging", "os", "re", "socket", "string", "sys",
            "textwrap", "traceback", "types", "unittest", "urlparse");

    private static final List<String> THIRD_PARTY = List.of(
            "djanjo", "eventlet", "keystoneclient", "mock", "mox3", "oslo",
            "selenium", "six", "subunit", "testtools", "webob", "wsme");

    private static final Set<String> APPLICATION = Set.of(
            "ceilometer", "cinder", "congress", "glance", "glance_store", "horizon",
            "neutron", "nova", "openstack_dashboard", "swift");

    public ModuleTables {
        stdlibModules = Set.copyOf(stdlibModules);
        thirdPartyPrefixes = List.copyOf(thirdPartyPrefixes);
        applicationModules = Set.copyOf(applicationModules);
    }

    /**
     * Built-in baseline tables.
     */
    public static ModuleTables defaults() {
        return new ModuleTables(STDLIB, THIRD_PARTY, APPLICATION);
    }

    /**
     * Copy of these tables extended with extra application names and third-party prefixes.
     * Blank entries are ignored.
     */
    public ModuleTables extendedWith(Collection<String> applicationNames, Collection<String> thirdPartyNames) {
        Set<String> application = new LinkedHashSet<>(applicationModules);
        applicationNames.stream().map(String::strip).filter(name -> !name.isEmpty()).forEach(application::add);

        List<String> thirdParty = new ArrayList<>(thirdPartyPrefixes);
        thirdPartyNames.stream().map(String::strip)
                .filter(name -> !name.isEmpty() && !thirdParty.contains(name))
                .forEach(thirdParty::add);

        return new ModuleTables(stdlibModules, thirdParty, application);
    }

    public boolean isThirdParty(String moduleName) {
        return thirdPartyPrefixes.stream().anyMatch(moduleName::startsWith);
    }

    public boolean isApplication(String moduleName) {
        return applicationModules.contains(moduleName);
    }

    public boolean isStdlib(String moduleName) {
        return stdlibModules.contains(moduleName);
    }
}
