package io.github.galkahana.testrunner;

public class Main {

    public static void main(String[] args) {
        System.exit(new Runner().main(args));
    }
}
