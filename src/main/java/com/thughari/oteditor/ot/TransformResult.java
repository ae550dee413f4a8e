package com.thughari.oteditor.ot;

import com.thughari.oteditor.model.Operation;

public final class TransformResult {
	public final Operation left;
	public final Operation right;

	private TransformResult(Operation left, Operation right) {
		this.left = left;
		this.right = right;
	}

	public static TransformResult of(Operation left, Operation right) {
		return new TransformResult(left, right);
	}

	public TransformResult swap() {
		return new TransformResult(right, left);
	}

	@Override
	public String toString() {
		return "{" +
				"left=" + left +
				", right=" + right +
				'}';
	}
}
