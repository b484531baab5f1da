package com.example.college_timetable.solver;

import com.google.ortools.Loader;

import lombok.extern.slf4j.Slf4j;

/**
 * Loads the OR-Tools JNI libraries once per JVM. Must run before the first
 * {@code CpModel} or {@code CpSolver} is created.
 */
@Slf4j
final class OrToolsNatives {
    private static boolean loaded = false;

    private OrToolsNatives() {
    }

    static synchronized void ensureLoaded() {
        if (!loaded) {
            Loader.loadNativeLibraries();
            loaded = true;
            log.debug("OR-Tools native libraries loaded");
        }
    }

    static synchronized boolean isLoaded() {
        return loaded;
    }
}
