package com.spatialassistant.app;

/**
 * Launcher for classpath runs, where the JavaFX runtime refuses to start a main class
 * that extends {@link javafx.application.Application} directly.
 */
public class Main {
    public static void main(String[] args) {
        MainApplication.main(args);
    }
}
