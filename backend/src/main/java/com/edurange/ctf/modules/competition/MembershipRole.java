package com.edurange.ctf.modules.competition;

public enum MembershipRole {
    INSTRUCTOR, MEMBER
}
