package com.zplat.ipld.entity.enumeration;

/** Classification of one raw IPL row; every row lands in exactly one bucket. */
public enum IplBucket {
    DONE,
    FAIL,
    GARBAGE
}
