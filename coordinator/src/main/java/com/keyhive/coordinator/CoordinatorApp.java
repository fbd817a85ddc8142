package com.keyhive.coordinator;

import com.keyhive.coordinator.cli.CoordinatorCli;

public class CoordinatorApp {

    public static void main(String[] args) {
        System.exit(CoordinatorCli.execute(args));
    }
}
