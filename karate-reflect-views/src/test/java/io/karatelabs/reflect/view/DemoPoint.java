package io.karatelabs.reflect.view;

public record DemoPoint(int x, int y) {

}
