package casper.ast;

public abstract class Statement extends Node {
}
